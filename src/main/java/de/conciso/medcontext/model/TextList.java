package de.conciso.medcontext.model;

import java.util.Collection;
import java.util.List;

public record TextList(List<String> items) implements SectionValue {

    public static final String SEPARATOR = "\n";

    public TextList {
        items = items == null ? List.of() : items.stream().map(i -> i == null ? "" : i).toList();
    }

    public static TextList of(Collection<String> items) {
        return new TextList(List.copyOf(items));
    }

    @Override
    public String serialize() {
        return String.join(SEPARATOR, items);
    }
}
