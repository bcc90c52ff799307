package com.finsight.data;

import com.finsight.errors.NoDataError;
import com.finsight.errors.TransientFetchError;
import com.finsight.model.HistoryRange;
import com.finsight.model.Quote;
import com.finsight.model.RawSeries;
import com.finsight.model.Symbol;

/**
 * Stateless access to a market data provider.
 */
public interface MarketDataGateway {

    RawSeries fetchHistory(Symbol symbol, HistoryRange range) throws TransientFetchError, NoDataError;

    Quote fetchQuote(Symbol symbol) throws TransientFetchError, NoDataError;

    String providerId();
}
