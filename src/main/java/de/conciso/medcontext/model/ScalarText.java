package de.conciso.medcontext.model;

public record ScalarText(String text) implements SectionValue {

    public ScalarText {
        text = text == null ? "" : text;
    }

    @Override
    public String serialize() {
        return text;
    }
}
