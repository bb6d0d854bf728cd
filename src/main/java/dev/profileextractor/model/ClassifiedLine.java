package dev.profileextractor.model;

/**
 * A text line with the label the classifier gave it.
 */
public record ClassifiedLine(TextLine line, LineLabel label) {

    public String content() {
        return line.content();
    }

    public int index() {
        return line.index();
    }

    public boolean is(LineLabel expected) {
        return label == expected;
    }
}
