package dev.devanks.hlsarchive.harvester.client;

import com.fasterxml.jackson.databind.JsonNode;
import dev.devanks.hlsarchive.harvester.config.CmrClientConfig;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;

/**
 * Feign client for the CMR granule search API.
 * Headers common to every request are added by CmrClientConfig.
 */
@FeignClient(name = "cmr-search",
        url = "${hls-archive.catalog.url}",
        configuration = CmrClientConfig.class)
public interface CmrSearchClient {

    String SEARCH_AFTER_HEADER = "CMR-Search-After";

    /**
     * One page of granules. The response's {@value #SEARCH_AFTER_HEADER} header, when present,
     * is the cursor for the next page.
     *
     * @param boundingBox "west,south,east,north", or null for no spatial filter
     * @param searchAfter cursor from the previous page, or null for the first page
     */
    @GetMapping("/search/granules.json")
    ResponseEntity<JsonNode> searchGranules(@RequestParam("collection_concept_id") String conceptId,
                                            @RequestParam("temporal") String temporal,
                                            @RequestParam(value = "bounding_box", required = false) String boundingBox,
                                            @RequestParam("page_size") int pageSize,
                                            @RequestHeader(value = SEARCH_AFTER_HEADER, required = false) String searchAfter);
}
