package com.ledgerlens.api.controller;

import com.ledgerlens.query.ProcessingLogView;
import com.ledgerlens.query.ProcessingQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/processing-logs")
@RequiredArgsConstructor
public class ProcessingLogController {

    private final ProcessingQueryService processingQueryService;

    @GetMapping("/{id}")
    public ResponseEntity<ProcessingLogView> getLog(@PathVariable String id) {
        return processingQueryService.findLog(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
