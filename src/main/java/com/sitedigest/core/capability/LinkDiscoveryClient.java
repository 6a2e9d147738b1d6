package com.sitedigest.core.capability;

import java.util.Set;

/**
 * Finds the links reachable from a seed page.
 */
public interface LinkDiscoveryClient {

    /**
     * @param seedUrl page to extract links from
     * @return discovered links in discovery order (absolute or origin-relative)
     * @throws CapabilityException if the provider call fails
     */
    Set<String> discoverLinks(String seedUrl);
}
