package org.normharvest.browser;

import org.junit.jupiter.api.Test;
import org.normharvest.http.BlockDetector;
import org.normharvest.http.EgressRotator;
import org.openqa.selenium.By;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;

import java.net.URL;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class PageLoaderTest {
    private static final BlockDetector BLOCKED = new BlockDetector(List.of("Acesso temporariamente bloqueado"));

    @Test
    void rotatesUntilBlockPageGoesAway() throws Exception {
        var driver = new ScriptedDriver("Acesso temporariamente bloqueado", "Acesso temporariamente bloqueado",
                "<html>Decreto 1</html>");
        var rotations = new AtomicInteger();
        var loader = new PageLoader(BLOCKED, () -> {
            rotations.incrementAndGet();
            return true;
        }, Duration.ZERO, 10);

        assertEquals("<html>Decreto 1</html>", loader.load(driver, "https://legislacao.example/decreto/1"));
        assertEquals(2, rotations.get());
        assertEquals(2, driver.refreshes);
        assertEquals(List.of("https://legislacao.example/decreto/1"), driver.visited);
    }

    @Test
    void givesUpAfterMaxRotations() throws Exception {
        var driver = new ScriptedDriver("Acesso temporariamente bloqueado");
        var rotations = new AtomicInteger();
        var loader = new PageLoader(BLOCKED, () -> {
            rotations.incrementAndGet();
            return false;
        }, Duration.ZERO, 3);

        assertNull(loader.load(driver, "https://legislacao.example/decreto/2"));
        assertEquals(3, rotations.get());
    }

    @Test
    void retriesBrowserErrors() throws Exception {
        var driver = new ScriptedDriver("<html>ok</html>");
        driver.failuresBeforeLoad = 2;
        var loader = new PageLoader(BLOCKED, () -> true, Duration.ZERO, 3);
        assertEquals("<html>ok</html>", loader.load(driver, "https://legislacao.example/lei/3"));

        var broken = new ScriptedDriver("<html>ok</html>");
        broken.failuresBeforeLoad = PageLoader.MAX_ATTEMPTS;
        assertNull(loader.load(broken, "https://legislacao.example/lei/4"));
    }

    @Test
    void skipsRotationAlreadyMadeByAnotherWorker() throws Exception {
        var rotator = new GenerationRotator();
        var loader = new PageLoader(BLOCKED, rotator, Duration.ZERO, 5);
        var driver = new ScriptedDriver("Acesso temporariamente bloqueado", "<html>Portaria 7</html>");
        long seenBeforeLoad = rotator.generation();
        rotator.rotate();

        assertTrue(loader.waitUntilUnblocked(driver, seenBeforeLoad));
        assertEquals(1, rotator.rotations.get());
        assertEquals(1, driver.refreshes);
    }

    private static class GenerationRotator implements EgressRotator {
        final AtomicInteger rotations = new AtomicInteger();
        private final AtomicLong generation = new AtomicLong();

        @Override
        public boolean rotate() {
            rotations.incrementAndGet();
            generation.incrementAndGet();
            return true;
        }

        @Override
        public long generation() {
            return generation.get();
        }

        @Override
        public boolean rotate(long seenGeneration) {
            return seenGeneration != generation.get() || rotate();
        }
    }

    /**
     * Returns the scripted page sources in turn, repeating the last one.
     */
    private static class ScriptedDriver implements WebDriver {
        private final Deque<String> pages;
        final List<String> visited = new ArrayList<>();
        int refreshes;
        int failuresBeforeLoad;

        ScriptedDriver(String... pages) {
            this.pages = new ArrayDeque<>(List.of(pages));
        }

        @Override
        public void get(String url) {
            if (failuresBeforeLoad > 0) {
                failuresBeforeLoad--;
                throw new WebDriverException("tab crashed");
            }
            visited.add(url);
        }

        @Override
        public String getPageSource() {
            return pages.peekFirst();
        }

        @Override
        public Navigation navigate() {
            return new Navigation() {
                @Override
                public void back() {
                }

                @Override
                public void forward() {
                }

                @Override
                public void to(String url) {
                    get(url);
                }

                @Override
                public void to(URL url) {
                    get(url.toString());
                }

                @Override
                public void refresh() {
                    refreshes++;
                    if (pages.size() > 1) pages.removeFirst();
                }
            };
        }

        @Override
        public String getCurrentUrl() {
            return visited.isEmpty() ? null : visited.get(visited.size() - 1);
        }

        @Override
        public String getTitle() {
            return "";
        }

        @Override
        public List<WebElement> findElements(By by) {
            return List.of();
        }

        @Override
        public WebElement findElement(By by) {
            throw new UnsupportedOperationException();
        }

        @Override
        public void close() {
        }

        @Override
        public void quit() {
        }

        @Override
        public Set<String> getWindowHandles() {
            return Set.of();
        }

        @Override
        public String getWindowHandle() {
            return "";
        }

        @Override
        public TargetLocator switchTo() {
            throw new UnsupportedOperationException();
        }

        @Override
        public Options manage() {
            throw new UnsupportedOperationException();
        }
    }
}
