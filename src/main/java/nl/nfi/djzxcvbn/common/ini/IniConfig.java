package nl.nfi.djzxcvbn.common.ini;

import org.json.JSONArray;
import org.json.JSONException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.Files.readAllLines;

public final class IniConfig {

    private final Map<String, Map<String, String>> sections;

    private IniConfig(final Map<String, Map<String, String>> sections) {
        this.sections = sections;
    }

    public boolean hasSection(final String section) {
        return sections.containsKey(section);
    }

    public boolean hasKey(final String section, final String key) {
        return sections.containsKey(section) && sections.get(section).containsKey(key);
    }

    public IniSection getSection(final String section) {
        if (!hasSection(section)) {
            throw new IllegalArgumentException("INI config does not contain given section: %s".formatted(section));
        }
        return IniSection.ofConfig(this, section);
    }

    public String getString(final String section, final String key) {
        if (!hasKey(section, key)) {
            throw new IllegalArgumentException("INI config does not contain key in given section: %s -> %s".formatted(section, key));
        }
        return sections.get(section).get(key);
    }

    public int getInt(final String section, final String key) {
        final String value = getString(section, key);
        try {
            return Integer.parseInt(value.trim());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("INI value is not an integer: %s -> %s = %s".formatted(section, key, value), e);
        }
    }

    public List<String> getList(final String section, final String key) {
        final String value = getString(section, key);
        try {
            final JSONArray array = new JSONArray(value);
            final List<String> values = new ArrayList<>(array.length());
            for (int i = 0; i < array.length(); i++) {
                values.add(array.getString(i));
            }
            return values;
        } catch (final JSONException e) {
            throw new IllegalArgumentException("INI value is not a JSON list of strings: %s -> %s = %s".formatted(section, key, value), e);
        }
    }

    public static IniConfig loadFrom(final Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("INI config file path does not exist: %s".formatted(path));
        }
        return parse(readAllLines(path, UTF_8));
    }

    public static IniConfig loadFrom(final InputStream input) throws IOException {
        try (final BufferedReader reader = new BufferedReader(new InputStreamReader(input, UTF_8))) {
            return parse(reader.lines().toList());
        }
    }

    static IniConfig parse(final List<String> lines) {
        final Map<String, Map<String, String>> sections = new LinkedHashMap<>();

        String sectionTitle = null;
        Map<String, String> section = new LinkedHashMap<>();
        for (final String rawLine : lines) {
            final String line = rawLine.strip();
            // skip blanks and comments
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) {
                continue;
            }
            if (line.startsWith("[")) {
                if (sectionTitle != null) {
                    sections.put(sectionTitle, section);
                    section = new LinkedHashMap<>();
                }
                sectionTitle = line.substring(0, line.length() - 1).substring(1);
            } else {
                final String[] parts = line.split(" = ", 2);
                if (parts.length == 1) {
                    section.put(parts[0], "");
                } else {
                    section.put(parts[0], parts[1]);
                }
            }
        }
        if (sectionTitle != null) {
            sections.put(sectionTitle, section);
        }
        return new IniConfig(sections);
    }
}
