package com.marketloop.advisory;

import java.util.List;

/**
 * Source of recent headlines. Implementations return an empty list on failure and
 * never throw.
 */
public interface HeadlineFeed {

    List<Headline> fetch();
}
