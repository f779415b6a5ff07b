// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.dom;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.jetbrains.annotations.NotNull;

/**
 * Conversion of keyword-style attribute names into canonical HTML attribute names.
 * <p>
 * Keywords are the names callers would use where an HTML name isn't a valid or convenient identifier:
 * {@code class_}, {@code data_row}, {@code http_equiv}. The attribute map of an {@link Element} only ever stores
 * names that went through {@link #normalize(String)}.
 */
public final class AttributeNames {
    private AttributeNames() {
    }

    /**
     * Converts a keyword into the canonical attribute name.
     * <p>
     * The keyword is lowercased, leading and trailing underscores or dashes (the reserved-word suffix, as in
     * {@code class_}) are dropped, and the remaining underscores become dashes. Case carries no meaning:
     * {@code tabIndex} is {@code tabindex}. The only exceptions are the dashed HTML names commonly written in
     * camelCase, {@code acceptCharset} and {@code httpEquiv}.
     *
     * @throws CompositionException if nothing is left of the keyword.
     */
    public static @NotNull String normalize(final @NotNull String keyword) {
        final var trimmed = edgePattern.matcher(keyword).replaceAll("");
        if (trimmed.isEmpty()) {
            throw new CompositionException("'" + keyword + "' is not a valid attribute name");
        }
        final var name = trimmed.replace('_', '-').toLowerCase(Locale.ROOT);
        return camelCaseNames.getOrDefault(name, name);
    }

    /**
     * Converts a CSS property keyword, such as {@code font_size} or {@code fontSize}, into the property name.
     * <p>
     * Unlike attribute names, leading dashes are kept, so vendor prefixes and custom properties survive.
     */
    public static @NotNull String cssProperty(final @NotNull String keyword) {
        return humpPattern.matcher(keyword).replaceAll("-").replace('_', '-').toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the name of a dashed attribute family member, e.g. {@code data-row} for family {@code data} and suffix
     * {@code row}. An empty suffix yields the bare family name.
     */
    public static @NotNull String dashed(final @NotNull String family, final @NotNull String suffix) {
        return suffix.isEmpty() ? family : family + '-' + normalize(suffix);
    }

    static boolean isStyle(final @NotNull String name) {
        return STYLE.equals(name);
    }

    static final String STYLE = "style";
    static final String CLASS = "class";

    private static final Map<String, String> camelCaseNames = Map.of(
        "acceptcharset", "accept-charset",
        "httpequiv", "http-equiv"
    );
    private static final Pattern humpPattern = Pattern.compile("(?<=[a-z0-9])(?=[A-Z])");
    private static final Pattern edgePattern = Pattern.compile("^[_-]+|[_-]+$");
}
