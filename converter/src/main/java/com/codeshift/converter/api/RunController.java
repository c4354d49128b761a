package com.codeshift.converter.api;

import com.codeshift.converter.api.dto.RunResponse;
import com.codeshift.converter.api.dto.SubmitRunRequest;
import com.codeshift.converter.config.ConfigurationException;
import com.codeshift.converter.model.TargetLanguage;
import com.codeshift.converter.service.RunRecord;
import com.codeshift.converter.service.RunService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * REST API for conversion runs (serve mode only).
 *
 * POST /runs        : queue a run over one or more source files
 * GET  /runs/{id}   : poll a run; the report is attached once it completes
 */
@RestController
@RequestMapping("/runs")
public class RunController {

    private final RunService runService;

    public RunController(RunService runService) {
        this.runService = runService;
    }

    /**
     * Queue a conversion run.
     *
     * Example:
     *   curl -X POST http://localhost:8080/runs \
     *     -H "Content-Type: application/json" \
     *     -d '{"sources":["legacy/Calculator.vb"],"targetLang":"CSHARP"}'
     */
    @PostMapping
    public ResponseEntity<RunResponse> submit(@RequestBody SubmitRunRequest req) {
        if (req.sources() == null || req.sources().isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "At least one source is required");
        }
        TargetLanguage language;
        try {
            language = TargetLanguage.parse(req.targetLang());
        } catch (ConfigurationException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        List<Path> sources = parseSources(req.sources());
        RunRecord record;
        try {
            record = runService.submit(sources, language, req.model());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(RunResponse.from(record));
    }

    private static List<Path> parseSources(List<String> raw) {
        List<Path> sources = new ArrayList<>(raw.size());
        for (String entry : raw) {
            if (entry == null || entry.isBlank()) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Source paths must not be blank");
            }
            try {
                sources.add(Path.of(entry));
            } catch (InvalidPathException e) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid source path: " + e.getMessage());
            }
        }
        return sources;
    }

    @GetMapping("/{id}")
    public RunResponse getRun(@PathVariable String id) {
        return runService.find(id)
                .map(RunResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Run not found: " + id));
    }
}
