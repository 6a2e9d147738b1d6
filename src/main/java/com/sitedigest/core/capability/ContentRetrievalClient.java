package com.sitedigest.core.capability;

import java.util.List;
import java.util.Map;

/**
 * Retrieves the text content of a batch of pages in a single provider call.
 */
public interface ContentRetrievalClient {

    /**
     * @param batch URLs to retrieve, in order
     * @return URL to extracted text for every page the provider could read;
     *         pages it could not read are simply absent
     * @throws CapabilityException if the call as a whole fails
     */
    Map<String, String> retrieveContent(List<String> batch);
}
