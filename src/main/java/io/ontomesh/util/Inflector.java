package io.ontomesh.util;

import java.util.Locale;
import java.util.Map;

/**
 * English singular and plural forms for table-name matching. Rules cover the regular
 * suffixes plus a short irregular list; results are lower case.
 */
public final class Inflector {
    private static final Map<String, String> IRREGULAR_SINGULARS = Map.ofEntries(
            Map.entry("people", "person"),
            Map.entry("children", "child"),
            Map.entry("men", "man"),
            Map.entry("women", "woman"),
            Map.entry("feet", "foot"),
            Map.entry("teeth", "tooth"),
            Map.entry("geese", "goose"),
            Map.entry("mice", "mouse"),
            Map.entry("oxen", "ox"),
            Map.entry("criteria", "criterion"),
            Map.entry("data", "datum")
    );
    private static final Map<String, String> IRREGULAR_PLURALS = Map.ofEntries(
            Map.entry("person", "people"),
            Map.entry("child", "children"),
            Map.entry("man", "men"),
            Map.entry("woman", "women"),
            Map.entry("foot", "feet"),
            Map.entry("tooth", "teeth"),
            Map.entry("goose", "geese"),
            Map.entry("mouse", "mice"),
            Map.entry("ox", "oxen"),
            Map.entry("criterion", "criteria"),
            Map.entry("datum", "data")
    );

    private Inflector() {
    }

    public static String singularize(String word) {
        String name = normalize(word);
        String irregular = IRREGULAR_SINGULARS.get(name);
        if (irregular != null) {
            return irregular;
        }
        int n = name.length();
        if (name.endsWith("ies") && n > 3) {
            return name.substring(0, n - 3) + "y";
        }
        if (name.endsWith("ves") && n > 3) {
            // knives -> knife, wolves -> wolf
            String base = name.substring(0, n - 3);
            return base.endsWith("i") ? base + "fe" : base + "f";
        }
        if (name.endsWith("ses") && n > 3) {
            return name.substring(0, n - 2);
        }
        if (name.endsWith("xes") && n > 3) {
            return name.substring(0, n - 2);
        }
        if (name.endsWith("zes") && n > 3) {
            // quizzes -> quiz
            if (n > 4 && name.charAt(n - 4) == name.charAt(n - 3)) {
                return name.substring(0, n - 3);
            }
            return name.substring(0, n - 2);
        }
        if (name.endsWith("shes") || name.endsWith("ches")) {
            return name.substring(0, n - 2);
        }
        if (name.endsWith("s") && n > 1) {
            if (name.endsWith("ss") || name.endsWith("us")) {
                return name;
            }
            return name.substring(0, n - 1);
        }
        return name;
    }

    public static String pluralize(String word) {
        String name = normalize(word);
        String irregular = IRREGULAR_PLURALS.get(name);
        if (irregular != null) {
            return irregular;
        }
        int n = name.length();
        if (name.endsWith("y") && n > 1 && !isVowel(name.charAt(n - 2))) {
            return name.substring(0, n - 1) + "ies";
        }
        if (name.endsWith("f") && n > 1) {
            return name.substring(0, n - 1) + "ves";
        }
        if (name.endsWith("fe") && n > 2) {
            return name.substring(0, n - 2) + "ves";
        }
        if (name.endsWith("s") || name.endsWith("x") || name.endsWith("z")
                || name.endsWith("ch") || name.endsWith("sh")) {
            return name + "es";
        }
        if (name.endsWith("o") && n > 1 && !isVowel(name.charAt(n - 2))) {
            return name + "es";
        }
        return name + "s";
    }

    private static String normalize(String word) {
        return word == null ? "" : word.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isVowel(char ch) {
        return ch == 'a' || ch == 'e' || ch == 'i' || ch == 'o' || ch == 'u';
    }
}
