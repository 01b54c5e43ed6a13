package resilient.driver;

import resilient.model.StrategyKind;
import resilient.resolver.CandidateStaleException;
import resilient.resolver.TransientDriverException;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scripted in-memory page for resolver and healing tests.
 *
 * <p>Every expression is absent unless scripted. Lookups and actions are recorded so tests
 * can assert on the exact sequence of driver calls.
 */
public class FakeBrowserDriver implements BrowserDriver {

    /** Handle for a scripted element, identified by {@code KIND:expression}. */
    public record FakeHandle(String key) implements ElementHandle {
        @Override
        public String describe() {
            return key;
        }
    }

    private static final class Element {
        boolean visible = true;
        boolean enabled = true;
        int staleChecks;
        RuntimeException lookupError;
    }

    private final Map<String, Element> elements = new HashMap<>();
    private final List<String> lookups = new ArrayList<>();
    private final List<String> clicks = new ArrayList<>();
    private final Map<String, String> typed = new HashMap<>();
    private final Deque<RuntimeException> actionFailures = new ArrayDeque<>();

    // ── Scripting ─────────────────────────────────────────────────────────

    public FakeBrowserDriver present(StrategyKind kind, String expression) {
        elements.put(key(kind, expression), new Element());
        return this;
    }

    /** Present in the DOM but never visible. */
    public FakeBrowserDriver hidden(StrategyKind kind, String expression) {
        Element e = new Element();
        e.visible = false;
        elements.put(key(kind, expression), e);
        return this;
    }

    /** Present and visible but never enabled. */
    public FakeBrowserDriver disabled(StrategyKind kind, String expression) {
        Element e = new Element();
        e.enabled = false;
        elements.put(key(kind, expression), e);
        return this;
    }

    /** Present, but the first {@code times} staleness checks report a stale reference. */
    public FakeBrowserDriver staleFor(StrategyKind kind, String expression, int times) {
        Element e = new Element();
        e.staleChecks = times;
        elements.put(key(kind, expression), e);
        return this;
    }

    /** Every lookup of the expression throws {@code error}. */
    public FakeBrowserDriver failing(StrategyKind kind, String expression, RuntimeException error) {
        Element e = new Element();
        e.lookupError = error;
        elements.put(key(kind, expression), e);
        return this;
    }

    public FakeBrowserDriver remove(StrategyKind kind, String expression) {
        elements.remove(key(kind, expression));
        return this;
    }

    /** The next click or type throws {@code error}; queue several for consecutive failures. */
    public FakeBrowserDriver failNextAction(RuntimeException error) {
        actionFailures.add(error);
        return this;
    }

    // ── Recorded calls ────────────────────────────────────────────────────

    public List<String> lookups()         { return lookups; }
    public List<String> clicks()          { return clicks; }
    public Map<String, String> typed()    { return typed; }

    public static String key(StrategyKind kind, String expression) {
        return kind.name() + ":" + expression;
    }

    // ── BrowserDriver ─────────────────────────────────────────────────────

    @Override
    public Optional<ElementHandle> exists(StrategyKind kind, String expression) {
        String key = key(kind, expression);
        lookups.add(key);
        Element e = elements.get(key);
        if (e == null) {
            return Optional.empty();
        }
        if (e.lookupError != null) {
            throw e.lookupError;
        }
        return Optional.of(new FakeHandle(key));
    }

    @Override
    public boolean waitUntilVisible(ElementHandle handle, Duration timeout) {
        Element e = elements.get(handle.describe());
        if (e == null) {
            throw new CandidateStaleException("Element removed: " + handle.describe());
        }
        return e.visible;
    }

    @Override
    public boolean waitUntilEnabled(ElementHandle handle, Duration timeout) {
        Element e = elements.get(handle.describe());
        if (e == null) {
            throw new CandidateStaleException("Element removed: " + handle.describe());
        }
        return e.visible && e.enabled;
    }

    @Override
    public void performClick(ElementHandle handle) {
        failIfScripted();
        clicks.add(handle.describe());
    }

    @Override
    public void performType(ElementHandle handle, String text) {
        failIfScripted();
        typed.put(handle.describe(), text);
    }

    @Override
    public boolean isStale(ElementHandle handle) {
        Element e = elements.get(handle.describe());
        if (e == null) {
            return true;
        }
        if (e.staleChecks > 0) {
            e.staleChecks--;
            return true;
        }
        return false;
    }

    private void failIfScripted() {
        RuntimeException next = actionFailures.poll();
        if (next != null) {
            throw next;
        }
    }

    /** Convenience for scripting transient driver failures. */
    public static TransientDriverException transientError(String message) {
        return new TransientDriverException(message, new RuntimeException(message));
    }
}
