package com.routeflow.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Catalog of domain specialists, bound from {@code routeflow.specialists.*}.
 * <p>
 * Descriptions feed the routing prompt, keywords feed the deterministic
 * fallback router. Every enabled entry is registered at startup.
 */
@Component
@ConfigurationProperties(prefix = "routeflow.specialists")
public class SpecialistProperties {

    private List<Definition> catalog = new ArrayList<>(defaultCatalog());

    public List<Definition> getCatalog() {
        return catalog;
    }

    public void setCatalog(List<Definition> catalog) {
        this.catalog = catalog;
    }

    public List<Definition> enabled() {
        return catalog.stream().filter(Definition::isEnabled).toList();
    }

    public static List<Definition> defaultCatalog() {
        return List.of(
                new Definition("performance_diagnosis",
                        "Analyzes campaign performance at insertion order level: spend, impressions, clicks, "
                                + "conversions, revenue, CTR, ROAS. Use for top-line campaign performance questions.",
                        List.of("performance", "campaign", "io", "insertion order", "metrics", "ctr", "roas",
                                "conversions", "kpis", "performing")),
                new Definition("budget_risk",
                        "Analyzes budget pacing, spend risk, underspend and overspend. Use for questions about "
                                + "budgets and pacing.",
                        List.of("budget", "budgets", "pacing", "spend", "allocation", "forecast", "risk",
                                "depletion", "overspend", "underspend")),
                new Definition("delivery_optimization",
                        "Analyzes delivery: impressions served, frequency, viewability, bid and win rate. Use for "
                                + "questions about under-delivery or delivery health.",
                        List.of("delivery", "delivering", "frequency", "viewability", "win rate", "bid", "bids",
                                "throttled", "under-delivery")),
                new Definition("audience_targeting",
                        "Analyzes line item level performance: audience segments, targeting tactics, line item "
                                + "comparison within an insertion order.",
                        List.of("audience", "audiences", "line item", "line items", "targeting", "segment",
                                "tactic", "remarketing", "prospecting")),
                new Definition("creative_inventory",
                        "Analyzes creative performance by creative name and ad size or format, including "
                                + "creative fatigue.",
                        List.of("creative", "creatives", "ad", "ads", "banner", "size", "format", "asset",
                                "fatigue", "300x250", "728x90"))
        );
    }

    /**
     * One specialist entry. Mutable for property binding.
     */
    public static class Definition {

        private String id;
        private String description = "";
        private List<String> keywords = new ArrayList<>();
        private boolean enabled = true;

        public Definition() {
        }

        public Definition(String id, String description, List<String> keywords) {
            this.id = id;
            this.description = description;
            this.keywords = new ArrayList<>(keywords);
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public List<String> getKeywords() {
            return keywords;
        }

        public void setKeywords(List<String> keywords) {
            this.keywords = keywords;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
