package com.heroku.relay.controllers;

import com.heroku.relay.model.TableQuery;
import com.heroku.relay.services.TableStoreException;
import com.heroku.relay.services.TableStoreService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CRUD passthrough onto Supabase tables
 */
@RestController
@RequestMapping("/api/tables")
public class TableController {

    private static final Logger logger = LoggerFactory.getLogger(TableController.class);

    @Autowired
    private TableStoreService tableStoreService;

    @PostMapping("/read")
    public Mono<List<Map<String, Object>>> read(@RequestBody TableQuery.Read query) {
        return offEventLoop(() -> tableStoreService.readRows(query));
    }

    @PostMapping("/create")
    public Mono<List<Map<String, Object>>> create(@RequestBody TableQuery.Create query) {
        return offEventLoop(() -> tableStoreService.createRecords(query));
    }

    @PostMapping("/update")
    public Mono<List<Map<String, Object>>> update(@RequestBody TableQuery.Update query) {
        return offEventLoop(() -> tableStoreService.updateRecords(query));
    }

    @PostMapping("/delete")
    public Mono<List<Map<String, Object>>> delete(@RequestBody TableQuery.Delete query) {
        return offEventLoop(() -> tableStoreService.deleteRecords(query));
    }

    // RestTemplate blocks, so table store calls run on the bounded elastic scheduler
    private Mono<List<Map<String, Object>>> offEventLoop(Callable<List<Map<String, Object>>> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> invalidQuery(IllegalArgumentException e) {
        Map<String, String> response = new HashMap<>();
        response.put("error", e.getMessage());
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(TableStoreException.class)
    public ResponseEntity<Map<String, String>> tableStoreFailure(TableStoreException e) {
        logger.warn("Table store request failed: {}", e.getMessage());
        Map<String, String> response = new HashMap<>();
        response.put("error", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(response);
    }
}
