package csw.crawler.render.playwright;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.microsoft.playwright.options.LoadState;

/**
 * Something a rendered page has to satisfy before its markup is read.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = WaitCondition.SelectorPresent.class, name = "selector-present"),
        @JsonSubTypes.Type(value = WaitCondition.SelectorVisible.class, name = "selector-visible"),
        @JsonSubTypes.Type(value = WaitCondition.UrlMatches.class, name = "url-matches"),
        @JsonSubTypes.Type(value = WaitCondition.ScriptTrue.class, name = "script-true"),
        @JsonSubTypes.Type(value = WaitCondition.LoadStateReached.class, name = "load-state")
})
public sealed interface WaitCondition {

    record SelectorPresent(String selector) implements WaitCondition {
    }

    record SelectorVisible(String selector) implements WaitCondition {
    }

    /** Current URL matches the regular expression. */
    record UrlMatches(String regex) implements WaitCondition {
    }

    /** A JavaScript expression evaluated in the page becomes truthy. */
    record ScriptTrue(String expression) implements WaitCondition {
    }

    record LoadStateReached(LoadState state) implements WaitCondition {
    }
}
