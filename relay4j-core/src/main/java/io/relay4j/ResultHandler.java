package io.relay4j;

import io.relay4j.core.ResultEvent;

@FunctionalInterface
public interface ResultHandler {

    void onResult(ResultEvent event) throws Exception;
}
