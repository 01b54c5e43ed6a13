package resilient.model;

import java.util.Objects;

/**
 * One concrete way to find an element: a strategy kind plus an expression.
 *
 * <p>Candidates are immutable. {@link #position()} is the declared index inside the
 * owning {@link LocatorChain}; candidates discovered by self-healing carry
 * {@link #HEALED_POSITION}.
 *
 * @param kind        lookup mechanism
 * @param expression  selector expression interpreted according to {@code kind}
 * @param description human-readable description used in logs and reports
 * @param position    declared position, or {@link #HEALED_POSITION}
 */
public record LocatorCandidate(StrategyKind kind, String expression, String description, int position) {

    /** Position marker for candidates produced by a healing strategy. */
    public static final int HEALED_POSITION = -1;

    /** Position marker for candidates not yet placed in a chain. */
    public static final int UNPLACED = -2;

    public LocatorCandidate {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(expression, "expression");
        if (expression.isBlank()) {
            throw new IllegalArgumentException("Locator expression must not be blank");
        }
        if (description == null || description.isBlank()) {
            description = kind.name().toLowerCase() + "=" + expression;
        }
    }

    /** Creates an unplaced candidate; {@link LocatorChain} assigns the position. */
    public static LocatorCandidate of(StrategyKind kind, String expression, String description) {
        return new LocatorCandidate(kind, expression, description, UNPLACED);
    }

    /** Creates an unplaced candidate whose description is derived from the expression. */
    public static LocatorCandidate of(StrategyKind kind, String expression) {
        return of(kind, expression, null);
    }

    /** Creates a candidate produced by self-healing. */
    public static LocatorCandidate healed(StrategyKind kind, String expression, String description) {
        return new LocatorCandidate(kind, expression, description, HEALED_POSITION);
    }

    /** Returns a copy of this candidate placed at {@code newPosition}. */
    public LocatorCandidate atPosition(int newPosition) {
        return new LocatorCandidate(kind, expression, description, newPosition);
    }

    /** Stable identity used by the metrics ledger: {@code kind:expression}. */
    public String key() {
        return kind.name() + ":" + expression;
    }

    public boolean isHealed() {
        return position == HEALED_POSITION;
    }

    @Override
    public String toString() {
        return String.format("LocatorCandidate{%s='%s'%s}", kind, expression, isHealed() ? " [HEALED]" : "");
    }
}
