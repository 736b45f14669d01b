package com.replcraft.scan;

/**
 * Reserved words of the grammar being read.
 */
public interface KeywordTable {
    KeywordClass classify(String word);
}
