package resilient.model;

/**
 * The lookup mechanism a {@link LocatorCandidate} uses to find an element.
 *
 * <p>Expression syntax per kind:
 * <ul>
 *   <li>{@link #ATTRIBUTE}: CSS attribute selector, e.g. {@code [data-testid='submit']}</li>
 *   <li>{@link #CSS}: structural CSS path, e.g. {@code form.login > button}</li>
 *   <li>{@link #XPATH}: hierarchical XPath, e.g. {@code //form//button[@type='submit']}</li>
 *   <li>{@link #TEXT}: exact visible text (whitespace-normalized)</li>
 *   <li>{@link #ROLE}: ARIA role, optionally with an accessible name: {@code button|Sign in}</li>
 * </ul>
 */
public enum StrategyKind {
    ATTRIBUTE,
    CSS,
    XPATH,
    TEXT,
    ROLE
}
