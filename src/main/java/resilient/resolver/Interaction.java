package resilient.resolver;

import java.util.Objects;

/**
 * What to do with a resolved element.
 *
 * @param kind  action kind
 * @param text  text to type, only for {@link Kind#TYPE}
 * @param state state to wait for, only for {@link Kind#WAIT_FOR_STATE}
 */
public record Interaction(Kind kind, String text, ElementState state) {

    public enum Kind { LOCATE, CLICK, TYPE, WAIT_FOR_STATE }

    /** States a resolved element can be waited into. Resolution itself already implies visibility. */
    public enum ElementState { VISIBLE, ENABLED }

    public Interaction {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.TYPE && text == null) {
            throw new IllegalArgumentException("TYPE interaction requires text");
        }
        if (kind == Kind.WAIT_FOR_STATE && state == null) {
            throw new IllegalArgumentException("WAIT_FOR_STATE interaction requires a state");
        }
    }

    public static Interaction locate()                   { return new Interaction(Kind.LOCATE, null, null); }
    public static Interaction click()                    { return new Interaction(Kind.CLICK, null, null); }
    public static Interaction type(String text)          { return new Interaction(Kind.TYPE, text, null); }
    public static Interaction waitFor(ElementState state) { return new Interaction(Kind.WAIT_FOR_STATE, null, state); }

    @Override
    public String toString() {
        return switch (kind) {
            case TYPE           -> "TYPE(" + text.length() + " chars)";
            case WAIT_FOR_STATE -> "WAIT_FOR_STATE(" + state + ")";
            default             -> kind.name();
        };
    }
}
