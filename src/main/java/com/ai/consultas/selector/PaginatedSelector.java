package com.ai.consultas.selector;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ai.consultas.dto.InlineKeyboard;
import com.ai.consultas.dto.KeyboardButton;

/**
 * Pages through a dynamically fetched list, one item per row, with
 * left/right navigation underneath. Pressing an item completes the selection.
 */
public class PaginatedSelector extends InlineSelector {

    private static final Logger log = LoggerFactory.getLogger(PaginatedSelector.class);

    public static final int DEFAULT_PAGE_LENGTH = 5;

    public static final String ACTION_LEFT = ACTION_MARKER + "left";
    public static final String ACTION_RIGHT = ACTION_MARKER + "right";

    private static final String LEFT_LABEL = "«";
    private static final String RIGHT_LABEL = "»";

    private final SelectorDataSource dataSource;
    private final int pageLength;

    private List<String> data;
    private int pageIndex;

    public PaginatedSelector(SelectorDataSource dataSource) {
        this(dataSource, DEFAULT_PAGE_LENGTH);
    }

    public PaginatedSelector(SelectorDataSource dataSource, int pageLength) {
        if (pageLength < 1) {
            throw new IllegalArgumentException("pageLength must be positive: " + pageLength);
        }
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.pageLength = pageLength;
    }

    /**
     * Replaces the cached list with a fresh fetch, dropping empty entries and
     * values that could not come back as a button token.
     * Exceptions thrown by the data source propagate to the caller.
     */
    public void fetchData() {
        List<String> fetched = dataSource.fetch();
        List<String> filtered = new ArrayList<>();
        if (fetched != null) {
            for (String value : fetched) {
                if (StringUtils.isEmpty(value)) {
                    continue;
                }
                if (isAction(value) || value.getBytes(StandardCharsets.UTF_8).length > MAX_TOKEN_BYTES) {
                    log.warn("Skipping selector value that cannot be used as a button token: '{}'", value);
                    continue;
                }
                filtered.add(value);
            }
        }
        data = Collections.unmodifiableList(filtered);
    }

    public boolean hasData() {
        return data != null && !data.isEmpty();
    }

    public List<String> getData() {
        return data;
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public int getPageLength() {
        return pageLength;
    }

    public List<String> currentPage() {
        requireData();
        int from = Math.min(pageIndex * pageLength, data.size());
        int to = Math.min(from + pageLength, data.size());
        return data.subList(from, to);
    }

    @Override
    public InlineKeyboard render() {
        InlineKeyboard.Builder builder = InlineKeyboard.builder();
        for (String item : currentPage()) {
            builder.row(KeyboardButton.of(item, item));
        }
        builder.row(KeyboardButton.of(LEFT_LABEL, ACTION_LEFT), KeyboardButton.of(RIGHT_LABEL, ACTION_RIGHT));
        markActive();
        return builder.build();
    }

    @Override
    public SelectorOutcome handleSelectorEvent(String token) {
        if (!isActive() || token == null) {
            return SelectorOutcome.ignored();
        }
        if (isAction(token)) {
            return handleNavigation(token);
        }
        markComplete();
        InlineKeyboard frozen = InlineKeyboard.builder()
                .row(KeyboardButton.of(token, NO_OP))
                .build();
        return SelectorOutcome.completed(token, frozen);
    }

    /**
     * Clears pagination and cached data; {@link #fetchData()} must run again before reuse.
     */
    public void reset() {
        rearm();
        pageIndex = 0;
        data = null;
    }

    private SelectorOutcome handleNavigation(String token) {
        if (ACTION_LEFT.equals(token)) {
            if (pageIndex == 0) {
                return SelectorOutcome.ignored();
            }
            pageIndex--;
            return SelectorOutcome.updated(render());
        }
        if (ACTION_RIGHT.equals(token)) {
            if ((pageIndex + 1) * pageLength >= data.size()) {
                return SelectorOutcome.ignored();
            }
            pageIndex++;
            return SelectorOutcome.updated(render());
        }
        return SelectorOutcome.ignored();
    }

    private void requireData() {
        if (data == null) {
            throw new IllegalStateException("fetchData() must be called before the selector is rendered");
        }
    }
}
