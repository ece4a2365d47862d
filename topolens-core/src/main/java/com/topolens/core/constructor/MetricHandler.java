package com.topolens.core.constructor;

import com.topolens.core.ingest.MetricQuery;
import com.topolens.core.model.MetricValues;
import java.util.List;

/** Folds the series of one catalog query into the world under construction. */
@FunctionalInterface
interface MetricHandler {

    void handle(MetricQuery query, List<MetricValues> metrics, ConstructionContext ctx);
}
