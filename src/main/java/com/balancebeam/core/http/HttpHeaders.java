package com.balancebeam.core.http;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered, case-insensitive collection of HTTP header fields.
 * Field names keep the spelling they arrived with so that a message can be
 * written back out exactly as it was received.
 */
public class HttpHeaders implements Iterable<HttpHeaders.Field> {

    /**
     * A single header field.
     *
     * @param name  Field name as received.
     * @param value Field value with surrounding whitespace removed.
     */
    public record Field(String name, String value) {
    }

    private final List<Field> fields = new ArrayList<>();

    /**
     * Appends a field, keeping any existing fields with the same name.
     *
     * @param name  Field name.
     * @param value Field value.
     */
    public void add(String name, String value) {
        fields.add(new Field(name, value));
    }

    /**
     * Returns the first value for the given name.
     *
     * @param name Field name (case-insensitive).
     * @return The first value, or null if absent.
     */
    public String get(String name) {
        for (Field field : fields) {
            if (field.name().equalsIgnoreCase(name)) {
                return field.value();
            }
        }
        return null;
    }

    /**
     * Returns every value for the given name in arrival order.
     *
     * @param name Field name (case-insensitive).
     * @return Possibly empty list of values.
     */
    public List<String> getAll(String name) {
        List<String> values = new ArrayList<>();
        for (Field field : fields) {
            if (field.name().equalsIgnoreCase(name)) {
                values.add(field.value());
            }
        }
        return values;
    }

    public boolean contains(String name) {
        return get(name) != null;
    }

    /**
     * Appends {@code value} to the existing value of {@code name}, separated by
     * {@code ", "}, or adds the field if it is absent. Duplicate fields with the
     * same name collapse into the first one.
     *
     * @param name  Field name.
     * @param value Value to append.
     */
    public void extend(String name, String value) {
        int first = -1;
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).name().equalsIgnoreCase(name)) {
                first = i;
                break;
            }
        }
        if (first == -1) {
            fields.add(new Field(name, value));
            return;
        }
        Field existing = fields.get(first);
        fields.set(first, new Field(existing.name(), existing.value() + ", " + value));
        for (Iterator<Field> it = fields.listIterator(first + 1); it.hasNext();) {
            if (it.next().name().equalsIgnoreCase(name)) {
                it.remove();
            }
        }
    }

    public int size() {
        return fields.size();
    }

    /**
     * Returns a read-only view of the fields in arrival order.
     *
     * @return Unmodifiable list of fields.
     */
    public List<Field> asList() {
        return Collections.unmodifiableList(fields);
    }

    @Override
    public Iterator<Field> iterator() {
        return asList().iterator();
    }
}
