package com.tradinggrok.core.gateway;

import com.tradinggrok.core.error.AnalysisUnavailable;
import com.tradinggrok.core.model.MarketContext;
import com.tradinggrok.core.model.Recommendation;

/**
 * Source of per-symbol trading recommendations.
 */
public interface AnalysisGateway {

    /**
     * @throws AnalysisUnavailable on timeout, transport failure or an unusable response
     */
    Recommendation getRecommendation(String symbol, MarketContext context) throws AnalysisUnavailable;
}
