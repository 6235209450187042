package com.tempodemo.echoservice.domain;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/** Renders request headers as {@code Name: value} lines, one line per value. */
public final class HeaderDump {

    private HeaderDump() {}

    /**
     * @param headers header name to all of its values, in any order
     * @return lines sorted by header name ignoring case, values in received order, each line
     *     terminated by {@code \n}
     */
    public static String render(Map<String, List<String>> headers) {
        List<String> names = new ArrayList<>(headers.keySet());
        names.sort(Comparator.<String, String>comparing(String::toLowerCase).thenComparing(Comparator.naturalOrder()));

        StringBuilder out = new StringBuilder();
        for (String name : names) {
            for (String value : headers.get(name)) {
                out.append(name).append(": ").append(value).append('\n');
            }
        }
        return out.toString();
    }
}
