package dev.profileextractor;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertTrue;

class ExitManagerTest {

  @Test
  void testExitInTestEnvironment() {
    ExitManager exitManager = new ExitManager();
    // Under surefire the JVM must survive both status codes
    exitManager.exit(0);
    exitManager.exit(1);
    assertTrue(exitManager.isTest());
  }
}
