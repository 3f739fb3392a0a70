package com.jetlang.h3.framing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

public class HeaderList implements Iterable<HeaderList.Header> {

    private final List<Header> headers;

    public HeaderList() {
        this(new ArrayList<>());
    }

    private HeaderList(List<Header> headers) {
        this.headers = headers;
    }

    public static HeaderList of(String... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("expected name/value pairs: " + namesAndValues.length);
        }
        HeaderList list = new HeaderList();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            list.add(namesAndValues[i], namesAndValues[i + 1]);
        }
        return list;
    }

    /**
     * @return first value for the name or null if it isn't present
     */
    public String get(String name) {
        for (int i = 0; i < headers.size(); i++) {
            Header header = headers.get(i);
            if (header.name.equals(name)) {
                return header.value;
            }
        }
        return null;
    }

    public List<String> getAll(String name) {
        List<String> result = new ArrayList<>();
        for (Header header : headers) {
            if (header.name.equals(name)) {
                result.add(header.value);
            }
        }
        return result;
    }

    public List<Header> getHeaders() {
        return headers;
    }

    public int size() {
        return headers.size();
    }

    public HeaderList add(String name, String value) {
        headers.add(new Header(name, value));
        return this;
    }

    public HeaderList addAll(HeaderList other) {
        headers.addAll(other.headers);
        return this;
    }

    public HeaderList unmodifiable() {
        return new HeaderList(Collections.unmodifiableList(new ArrayList<>(headers)));
    }

    @Override
    public Iterator<Header> iterator() {
        return headers.iterator();
    }

    @Override
    public void forEach(Consumer<? super Header> action) {
        headers.forEach(action);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof HeaderList && headers.equals(((HeaderList) o).headers);
    }

    @Override
    public int hashCode() {
        return headers.hashCode();
    }

    @Override
    public String toString() {
        return headers.toString();
    }

    public static class Header {

        private final String name;
        private final String value;

        public Header(String name, String value) {
            this.name = Objects.requireNonNull(name, "name");
            this.value = Objects.requireNonNull(value, "value");
        }

        public String getName() {
            return name;
        }

        public String getValue() {
            return value;
        }

        public boolean isPseudoHeader() {
            return name.startsWith(":");
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Header)) {
                return false;
            }
            Header other = (Header) o;
            return name.equals(other.name) && value.equals(other.value);
        }

        @Override
        public int hashCode() {
            return 31 * name.hashCode() + value.hashCode();
        }

        @Override
        public String toString() {
            return name + '=' + value;
        }
    }
}
