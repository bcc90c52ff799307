package com.finsight.data;

import com.finsight.errors.NoDataError;
import com.finsight.errors.TransientFetchError;
import com.finsight.model.NewsItem;
import com.finsight.model.Symbol;

import java.util.List;

/**
 * Per-symbol headline feed.
 */
public interface HeadlineSource {

    String sourceId();

    List<NewsItem> fetchHeadlines(Symbol symbol, int limit) throws TransientFetchError, NoDataError;
}
