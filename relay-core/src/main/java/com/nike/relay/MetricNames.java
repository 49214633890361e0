package com.nike.relay;

/**
 * Metric and segment name fragments shared by the instrumentation and the recorders.
 */
public interface MetricNames {

    String EXTERNAL_PREFIX = "External/";

    String EXTERNAL_ALL = "External/all";

    String EXTERNAL_ALL_WEB = "External/allWeb";

    String EXTERNAL_ALL_OTHER = "External/allOther";

    String EXTERNAL_APP = "ExternalApp/";

    String EXTERNAL_TRANSACTION = "ExternalTransaction/";

}
