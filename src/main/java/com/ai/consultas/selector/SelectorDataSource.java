package com.ai.consultas.selector;

import java.util.List;

/**
 * Supplies a freshly fetched, ordered list of choices for one logical field.
 */
@FunctionalInterface
public interface SelectorDataSource {

    List<String> fetch();
}
