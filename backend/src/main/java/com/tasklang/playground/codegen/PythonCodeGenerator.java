package com.tasklang.playground.codegen;

import com.tasklang.playground.parser.ast.Program;
import com.tasklang.playground.parser.ast.Selector;
import com.tasklang.playground.parser.ast.SelectorKind;
import com.tasklang.playground.parser.ast.Statement;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Emits a Python Selenium script for a program that already passed semantic analysis.
 *
 * <p>Output is built as a flat list of lines, one small emitter per statement kind.
 * Every string interpolated into the script goes through {@link #escape(String)}.
 */
public class PythonCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(PythonCodeGenerator.class);

    static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    static final int STABILIZE_SECONDS = 2;

    private static final Selector DEFAULT_LOCATOR = new Selector(SelectorKind.NAME, "q");

    private static final List<String> PREAMBLE = List.of(
            "from selenium import webdriver",
            "from selenium.webdriver.chrome.options import Options as ChromeOptions",
            "from selenium.webdriver.firefox.options import Options as FirefoxOptions",
            "from selenium.webdriver.edge.options import Options as EdgeOptions",
            "from selenium.webdriver.common.by import By",
            "from selenium.webdriver.common.keys import Keys",
            "from selenium.webdriver.support.ui import WebDriverWait",
            "from selenium.webdriver.support import expected_conditions as EC",
            "import time");

    public String generate(Program program) {
        List<String> lines = new ArrayList<>(PREAMBLE);
        lines.add("");

        Emitter emitter = new Emitter(lines);
        for (Statement statement : program.statements()) {
            statement.accept(emitter);
        }

        logger.debug("Generated {} lines for {} statements", lines.size(), program.size());
        return String.join("\n", lines);
    }

    /**
     * Escapes a value for a double-quoted Python string literal.
     * Backslashes are doubled before quotes are escaped.
     */
    static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    static String locator(Selector selector) {
        return byConstant(selector.kind()) + ", \"" + escape(selector.value()) + "\"";
    }

    private static String byConstant(SelectorKind kind) {
        switch (kind) {
            case ID:
                return "By.ID";
            case NAME:
                return "By.NAME";
            case XPATH:
                return "By.XPATH";
            case CSS:
                return "By.CSS_SELECTOR";
            case TAG:
                return "By.TAG_NAME";
            default:
                throw new IllegalArgumentException("Unsupported selector kind: " + kind);
        }
    }

    private static final class Emitter implements Statement.Visitor<Void> {

        private final List<String> lines;

        Emitter(List<String> lines) {
            this.lines = lines;
        }

        @Override
        public Void visitOpen(Statement.Open statement) {
            BrowserKind browser = BrowserKind.fromName(statement.browser());
            switch (browser) {
                case FIREFOX:
                    firefox();
                    break;
                case EDGE:
                    edge();
                    break;
                case SAFARI:
                    lines.add("driver = webdriver.Safari()");
                    break;
                case UNKNOWN:
                    lines.add("# Unknown browser '" + statement.browser() + "', defaulting to Chrome");
                    chrome();
                    break;
                case CHROME:
                default:
                    chrome();
                    break;
            }
            lines.add("time.sleep(" + STABILIZE_SECONDS + ")");
            return null;
        }

        private void chrome() {
            lines.add("# Configure Chrome options to avoid bot detection");
            lines.add("chrome_options = ChromeOptions()");
            lines.add("chrome_options.add_argument('--disable-blink-features=AutomationControlled')");
            lines.add("chrome_options.add_experimental_option('excludeSwitches', ['enable-automation'])");
            lines.add("chrome_options.add_experimental_option('useAutomationExtension', False)");
            lines.add("chrome_options.add_argument('--disable-dev-shm-usage')");
            lines.add("chrome_options.add_argument('--no-sandbox')");
            lines.add("chrome_options.add_argument('--window-size=1920,1080')");
            lines.add("chrome_options.add_argument('user-agent=" + USER_AGENT + "')");
            lines.add("driver = webdriver.Chrome(options=chrome_options)");
            lines.add("# Execute script to remove webdriver property");
            lines.add("driver.execute_script(\"Object.defineProperty(navigator, 'webdriver', "
                    + "{get: () => undefined})\")");
        }

        private void firefox() {
            lines.add("firefox_options = FirefoxOptions()");
            lines.add("firefox_options.set_preference('dom.webdriver.enabled', False)");
            lines.add("firefox_options.set_preference('useAutomationExtension', False)");
            lines.add("driver = webdriver.Firefox(options=firefox_options)");
            lines.add("driver.maximize_window()");
        }

        private void edge() {
            lines.add("edge_options = EdgeOptions()");
            lines.add("edge_options.add_argument('--disable-blink-features=AutomationControlled')");
            lines.add("edge_options.add_experimental_option('excludeSwitches', ['enable-automation'])");
            lines.add("driver = webdriver.Edge(options=edge_options)");
            lines.add("driver.maximize_window()");
        }

        @Override
        public Void visitGo(Statement.Go statement) {
            lines.add("driver.get(\"" + escape(statement.url()) + "\")");
            return null;
        }

        @Override
        public Void visitType(Statement.Type statement) {
            lines.add("driver.find_element(" + locator(statement.selector().orElse(DEFAULT_LOCATOR))
                    + ").send_keys(\"" + escape(statement.text()) + "\")");
            return null;
        }

        @Override
        public Void visitClick(Statement.Click statement) {
            Selector selector = statement.selector().orElse(DEFAULT_LOCATOR);
            List<String> alternatives = alternatives(statement.selector());
            if (alternatives.size() > 1) {
                clickFirstMatching(alternatives);
            } else if (alternatives.size() == 1) {
                clickSingle(new Selector(SelectorKind.CSS, alternatives.get(0)));
            } else {
                clickSingle(selector);
            }
            return null;
        }

        // Only CSS selectors support comma-separated fallbacks.
        private List<String> alternatives(Optional<Selector> selector) {
            if (selector.isEmpty()
                    || selector.get().kind() != SelectorKind.CSS
                    || !selector.get().value().contains(",")) {
                return List.of();
            }
            return Arrays.stream(selector.get().value().split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toList());
        }

        private void clickSingle(Selector selector) {
            lines.add("try:");
            lines.add("    driver.find_element(" + locator(selector) + ").click()");
            lines.add("except Exception as e:");
            lines.add("    print(\"Warning: could not click element:\", e)");
        }

        private void clickFirstMatching(List<String> alternatives) {
            lines.add("clicked = False");
            for (String alternative : alternatives) {
                lines.add("if not clicked:");
                lines.add("    try:");
                lines.add("        driver.find_element(" + locator(new Selector(SelectorKind.CSS, alternative))
                        + ").click()");
                lines.add("        clicked = True");
                lines.add("    except Exception:");
                lines.add("        pass");
            }
            lines.add("if not clicked:");
            lines.add("    print(\"Warning: no element matched any of " + alternatives.size()
                    + " selectors, continuing\")");
        }

        @Override
        public Void visitEnter(Statement.Enter statement) {
            lines.add("driver.find_element(" + locator(statement.selector().orElse(DEFAULT_LOCATOR))
                    + ").send_keys(Keys.ENTER)");
            return null;
        }

        @Override
        public Void visitWait(Statement.Wait statement) {
            lines.add("time.sleep(" + statement.seconds() + ")");
            return null;
        }

        @Override
        public Void visitScreenshot(Statement.Screenshot statement) {
            lines.add("driver.save_screenshot(\"" + escape(statement.filename()) + "\")");
            return null;
        }

        @Override
        public Void visitClose(Statement.Close statement) {
            lines.add("driver.quit()");
            return null;
        }
    }
}
