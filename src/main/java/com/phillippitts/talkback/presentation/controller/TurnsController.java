package com.phillippitts.talkback.presentation.controller;

import com.phillippitts.talkback.exception.TurnNotFoundException;
import com.phillippitts.talkback.service.cancel.ProcessInfo;
import com.phillippitts.talkback.service.cancel.ProcessRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator endpoints over the process registry: list running turns and stop them.
 */
@RestController
@RequestMapping("/api/turns")
class TurnsController {

    private static final Logger LOG = LogManager.getLogger(TurnsController.class);
    private static final String DEFAULT_REASON = "stopped by operator";

    private final ProcessRegistry registry;

    TurnsController(ProcessRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    List<Map<String, Object>> list() {
        return registry.activeProcesses().stream().map(TurnsController::toView).toList();
    }

    @DeleteMapping("/{id}")
    ResponseEntity<Map<String, Object>> stop(@PathVariable("id") String id,
                                             @RequestParam(name = "reason", defaultValue = DEFAULT_REASON)
                                             String reason) {
        if (!registry.stop(id, reason)) {
            throw new TurnNotFoundException(id);
        }
        LOG.info("Turn {} stopped via API", id);
        return ResponseEntity.accepted().body(Map.of("turnId", id, "stopped", true));
    }

    @PostMapping("/stop-all")
    Map<String, Object> stopAll(@RequestParam(name = "reason", defaultValue = DEFAULT_REASON) String reason) {
        int stopped = registry.stopAll(reason);
        LOG.info("{} turns stopped via API", stopped);
        return Map.of("stopped", stopped);
    }

    private static Map<String, Object> toView(ProcessInfo info) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", info.id());
        view.put("name", info.name());
        view.put("startedAt", info.startedAt().toString());
        view.put("sessionId", info.metadata().sessionId());
        view.put("language", info.metadata().language());
        view.put("voice", info.metadata().voice());
        return view;
    }
}
