package nl.nfi.djzxcvbn.estimate.feedback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

import static java.nio.charset.StandardCharsets.UTF_8;

// message bundles under /locale, looked up along exact tag -> base language -> default (english)
public final class LocaleTranslator implements Translator {

    private static final Logger LOG = LoggerFactory.getLogger(LocaleTranslator.class);

    public static final String DEFAULT_LANGUAGE = "en";

    static final String RESOURCE_DIRECTORY = "/locale/";
    static final String BUNDLE_NAME = "messages";

    private final String language;
    private final List<Properties> bundles;

    private LocaleTranslator(final String language, final List<Properties> bundles) {
        this.language = language;
        this.bundles = bundles;
    }

    public static LocaleTranslator defaultLanguage() {
        return forLanguage(DEFAULT_LANGUAGE);
    }

    // accepts zh-CN as well as zh_CN
    public static LocaleTranslator forLanguage(final String languageTag) {
        final String language = normalize(languageTag);
        final List<Properties> bundles = new ArrayList<>();
        final List<String> found = new ArrayList<>();
        for (final String candidate : fallbackChain(language)) {
            final Properties bundle = loadBundle(RESOURCE_DIRECTORY + BUNDLE_NAME + "_" + candidate + ".properties");
            if (bundle != null) {
                bundles.add(bundle);
                found.add(candidate);
            }
        }
        final Properties defaults = loadBundle(RESOURCE_DIRECTORY + BUNDLE_NAME + ".properties");
        if (defaults == null) {
            throw new IllegalStateException("Default message bundle is missing from the classpath");
        }
        bundles.add(defaults);

        LOG.debug("Translator for {} uses bundles {} before the default", language, found);
        return new LocaleTranslator(language, List.copyOf(bundles));
    }

    static List<String> fallbackChain(final String language) {
        final Set<String> chain = new LinkedHashSet<>();
        chain.add(language);
        if (language.equals("zh") || language.startsWith("zh_")) {
            // simplified chinese is the canonical chinese bundle
            chain.add("zh_CN");
            chain.add("zh");
        } else {
            final int separator = language.indexOf('_');
            if (separator > 0) {
                chain.add(language.substring(0, separator));
            }
        }
        return List.copyOf(chain);
    }

    public String language() {
        return language;
    }

    @Override
    public String translate(final String key) {
        for (final Properties bundle : bundles) {
            final String value = bundle.getProperty(key);
            if (value != null) {
                return value;
            }
        }
        // untranslated keys show up as themselves instead of failing the evaluation
        return key;
    }

    private static String normalize(final String languageTag) {
        if (languageTag == null || languageTag.isBlank()) {
            return DEFAULT_LANGUAGE;
        }
        final String[] parts = languageTag.strip().replace('-', '_').split("_");
        final StringBuilder normalized = new StringBuilder(parts[0].toLowerCase(Locale.ROOT));
        for (int i = 1; i < parts.length; i++) {
            // regions are upper case (zh_CN), scripts title case (zh_Hans)
            final String part = parts[i];
            if (part.isEmpty()) {
                continue;
            }
            normalized.append('_').append(part.length() == 2
                    ? part.toUpperCase(Locale.ROOT)
                    : part.substring(0, 1).toUpperCase(Locale.ROOT) + part.substring(1).toLowerCase(Locale.ROOT));
        }
        return normalized.toString();
    }

    private static Properties loadBundle(final String resource) {
        final InputStream input = LocaleTranslator.class.getResourceAsStream(resource);
        if (input == null) {
            return null;
        }
        try (final Reader reader = new InputStreamReader(input, UTF_8)) {
            final Properties bundle = new Properties();
            bundle.load(reader);
            return bundle;
        }
        catch (final IOException e) {
            throw new UncheckedIOException("Failed to load message bundle %s".formatted(resource), e);
        }
    }
}
