package resilient.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A logical element expressed as an ordered, non-empty list of {@link LocatorCandidate}s.
 *
 * <p>The declared order is the author's preference and never changes; the order in which
 * candidates are actually tried at runtime is computed separately by
 * {@link resilient.ordering.AdaptiveOrderingEngine}. Chains are immutable and safe to share
 * between threads.
 *
 * <pre>{@code
 * LocatorChain searchButton = LocatorChain.builder("search.submit")
 *         .description("Search submit button")
 *         .attribute("[data-testid='search-submit']")
 *         .css("form.search button.primary")
 *         .xpath("//form[@role='search']//button")
 *         .text("Search")
 *         .build();
 * }</pre>
 */
public final class LocatorChain {

    private final String id;
    private final String description;
    private final List<LocatorCandidate> candidates;

    private LocatorChain(String id, String description, List<LocatorCandidate> candidates) {
        this.id          = id;
        this.description = description;
        this.candidates  = candidates;
    }

    /**
     * Creates a chain from already-built candidates, assigning declared positions in
     * argument order.
     *
     * @throws IllegalArgumentException if no candidates are given or two share a key
     */
    public static LocatorChain of(String id, String description, LocatorCandidate... candidates) {
        Builder b = builder(id).description(description);
        for (LocatorCandidate c : candidates) {
            b.candidate(c);
        }
        return b.build();
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String id() { return id; }

    /** Human-readable description; also serves as the semantic hint for self-healing. */
    public String description() { return description; }

    /** Declared candidates in declared order (unmodifiable). */
    public List<LocatorCandidate> candidates() { return candidates; }

    public int size() { return candidates.size(); }

    /** The hint handed to healing strategies: the description, or the id when none was given. */
    public String healingHint() {
        return description != null && !description.isBlank() ? description : id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LocatorChain)) return false;
        LocatorChain that = (LocatorChain) o;
        return id.equals(that.id) && candidates.equals(that.candidates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, candidates);
    }

    @Override
    public String toString() {
        return "LocatorChain{" + id + ", " + candidates.size() + " candidate(s)}";
    }

    /** Fluent builder; positions are assigned in the order candidates are added. */
    public static final class Builder {

        private final String id;
        private String description;
        private final List<LocatorCandidate> candidates = new ArrayList<>();

        private Builder(String id) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Chain id must not be blank");
            }
            this.id = id;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder candidate(LocatorCandidate candidate) {
            candidates.add(Objects.requireNonNull(candidate, "candidate"));
            return this;
        }

        public Builder candidate(StrategyKind kind, String expression, String description) {
            return candidate(LocatorCandidate.of(kind, expression, description));
        }

        public Builder attribute(String selector) { return candidate(StrategyKind.ATTRIBUTE, selector, null); }
        public Builder css(String selector)       { return candidate(StrategyKind.CSS, selector, null); }
        public Builder xpath(String xpath)        { return candidate(StrategyKind.XPATH, xpath, null); }
        public Builder text(String text)          { return candidate(StrategyKind.TEXT, text, null); }
        public Builder role(String role)          { return candidate(StrategyKind.ROLE, role, null); }

        public LocatorChain build() {
            if (candidates.isEmpty()) {
                throw new IllegalArgumentException("Locator chain '" + id + "' must declare at least one candidate");
            }
            List<LocatorCandidate> placed = new ArrayList<>(candidates.size());
            Set<String> keys = new HashSet<>();
            for (int i = 0; i < candidates.size(); i++) {
                LocatorCandidate c = candidates.get(i);
                if (!keys.add(c.key())) {
                    throw new IllegalArgumentException(
                            "Locator chain '" + id + "' declares duplicate candidate " + c.key());
                }
                placed.add(c.atPosition(i));
            }
            return new LocatorChain(id, description, Collections.unmodifiableList(placed));
        }
    }
}
