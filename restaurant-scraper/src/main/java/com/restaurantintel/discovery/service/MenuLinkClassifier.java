package com.restaurantintel.discovery.service;

import com.restaurantintel.discovery.config.DiscoveryProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Decides whether an anchor plausibly points at a menu.
 *
 *  1. A link whose path ends in .pdf is a hit on its own.
 *  2. Otherwise href + text must contain a menu keyword, and the href must not
 *     contain an excluded term (social, login, booking widgets).
 *
 * Exclusions are matched against the href only.
 */
@Component
public class MenuLinkClassifier {

    private final List<String> menuKeywords;
    private final List<String> excludedTerms;

    @Autowired
    public MenuLinkClassifier(DiscoveryProperties properties) {
        this(properties.getCrawl().getMenuKeywords(), properties.getCrawl().getExcludedTerms());
    }

    public MenuLinkClassifier(List<String> menuKeywords, List<String> excludedTerms) {
        this.menuKeywords = lowercase(menuKeywords);
        this.excludedTerms = lowercase(excludedTerms);
    }

    public boolean isMenuLink(String href, String text) {
        String lowerHref = href == null ? "" : href.toLowerCase(Locale.ROOT);
        String lowerText = text == null ? "" : text.toLowerCase(Locale.ROOT);

        if (path(lowerHref).endsWith(".pdf")) {
            return true;
        }

        String combined = lowerHref + " " + lowerText;
        boolean keyword = menuKeywords.stream().anyMatch(combined::contains);
        if (!keyword) {
            return false;
        }
        return excludedTerms.stream().noneMatch(lowerHref::contains);
    }

    private static String path(String href) {
        int end = href.length();
        int query = href.indexOf('?');
        int fragment = href.indexOf('#');
        if (query >= 0) end = Math.min(end, query);
        if (fragment >= 0) end = Math.min(end, fragment);
        return href.substring(0, end);
    }

    private static List<String> lowercase(List<String> terms) {
        return terms.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(t -> t.trim().toLowerCase(Locale.ROOT))
                .toList();
    }
}
