package com.example.filesearch;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/search")
public class SearchController {

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(SearchController.class);

    @Autowired
    private QueryEngine queryEngine;

    @Value("${query.default.top-k:10}")
    private int defaultTopK;

    @GetMapping
    public List<SearchHit> search(@RequestParam(name = "q") String query,
                                  @RequestParam(name = "topK", required = false) Integer topK,
                                  @RequestParam(name = "optimize", defaultValue = "true") boolean optimize) {
        int k = topK == null ? defaultTopK : topK;
        log.info("Received search: '{}' (topK={}, optimize={})", query, k, optimize);
        List<SearchHit> hits = queryEngine.search(query, k, optimize);
        log.info("Returning {} hits for '{}'", hits.size(), query);
        return hits;
    }
}
