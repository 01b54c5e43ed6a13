package resilient.driver;

import resilient.model.StrategyKind;

import org.openqa.selenium.By;

/**
 * Converts candidate expressions into Selenium {@link By} locators and builds safely
 * quoted selector literals.
 */
public final class SeleniumLocators {

    private SeleniumLocators() { }

    /**
     * Maps a strategy kind and expression to a {@link By}.
     *
     * <ul>
     *   <li>ATTRIBUTE / CSS: {@link By#cssSelector}</li>
     *   <li>XPATH: {@link By#xpath}</li>
     *   <li>TEXT: XPath on whitespace-normalized text equality</li>
     *   <li>ROLE: {@code [role='r']}, or {@code [role='r'][aria-label*='name']} for {@code r|name}</li>
     * </ul>
     */
    public static By toBy(StrategyKind kind, String expression) {
        return switch (kind) {
            case ATTRIBUTE, CSS -> By.cssSelector(expression);
            case XPATH          -> By.xpath(expression);
            case TEXT           -> By.xpath("//*[normalize-space(text())=" + xpathLiteral(expression.trim()) + "]");
            case ROLE           -> By.cssSelector(roleSelector(expression));
        };
    }

    /** CSS selector for a {@code role} or {@code role|accessible name} expression. */
    public static String roleSelector(String expression) {
        int bar = expression.indexOf('|');
        if (bar < 0) {
            return "[role=" + cssString(expression.trim()) + "]";
        }
        String role = expression.substring(0, bar).trim();
        String name = expression.substring(bar + 1).trim();
        return "[role=" + cssString(role) + "][aria-label*=" + cssString(name) + "]";
    }

    /** Quotes {@code value} as an XPath string literal, using {@code concat()} when it holds both quote kinds. */
    public static String xpathLiteral(String value) {
        if (!value.contains("'")) {
            return "'" + value + "'";
        }
        if (!value.contains("\"")) {
            return "\"" + value + "\"";
        }
        StringBuilder sb = new StringBuilder("concat(");
        String[] parts = value.split("'", -1);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append(", \"'\", ");
            }
            sb.append('\'').append(parts[i]).append('\'');
        }
        return sb.append(')').toString();
    }

    /** Quotes {@code value} as a single-quoted CSS string. */
    public static String cssString(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}
