package com.raditha.lint.config;

import java.util.List;

/**
 * Call names whose string arguments are exempt.
 * A name matches when it equals an exact entry, ends with a suffix entry or
 * starts with a prefix entry.
 *
 * @param exact  Call names matched exactly
 * @param suffix Suffixes such as ".localizedStringForKey"
 * @param prefix Prefixes such as "XCTAssert"
 */
public record CallWhitelist(
        List<String> exact,
        List<String> suffix,
        List<String> prefix) {

    public CallWhitelist {
        if (exact == null || suffix == null || prefix == null) {
            throw new IllegalArgumentException("whitelist tables cannot be null");
        }
        exact = List.copyOf(exact);
        suffix = List.copyOf(suffix);
        prefix = List.copyOf(prefix);
    }

    /**
     * Tables for Cocoa style sources: logging, assertions, localization and
     * selectors.
     */
    public static CallWhitelist defaults() {
        return new CallWhitelist(
                List.of("print", "assert", "NSLog", "NSLocalizedString", "Selector"),
                List.of(".localizedStringForKey"),
                List.of("XCTAssert"));
    }

    /**
     * Tables for Java sources: console output, logger calls, resource bundle
     * lookups, assertions and annotations.
     */
    public static CallWhitelist java() {
        return new CallWhitelist(
                List.of(
                        "System.out.println",
                        "System.out.print",
                        "System.err.println",
                        "System.err.print"),
                List.of(
                        ".getString",
                        ".getMessage",
                        ".trace",
                        ".debug",
                        ".info",
                        ".warn",
                        ".error"),
                List.of(
                        "assert",
                        "Assertions.assert",
                        "@"));
    }

    /**
     * Check a call name against all three tables.
     *
     * @param callName callee text, e.g. "obj.localizedStringForKey"
     * @return true if the call is whitelisted
     */
    public boolean matches(String callName) {
        if (callName == null) {
            return false;
        }
        return exact.contains(callName)
                || suffix.stream().anyMatch(callName::endsWith)
                || prefix.stream().anyMatch(callName::startsWith);
    }
}
