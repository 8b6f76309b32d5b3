package com.nan.redislite.api;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.nan.redislite.model.KeyValue;
import com.nan.redislite.model.StoreStats;
import com.nan.redislite.service.KvService;

/*
  HTTP view of the same store the RESP listener serves.
  Keys and values go in and out as UTF-8 text, so a key set here matches the
  same UTF-8 key sent over RESP.
*/
@RestController
@RequestMapping("/kv")
public class KvController {

    private final KvService service;

    public KvController(KvService service) {
        this.service = service;
    }

    // GET /kv/health -> {"status":"UP"}
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    // PUT /kv/put?key=...&value=...
    @PutMapping("/put")
    public ResponseEntity<KeyValue> put(@RequestParam String key, @RequestParam String value) {
        if (key.isBlank()) return ResponseEntity.badRequest().build();
        service.put(utf8(key), utf8(value));
        return ResponseEntity.ok(new KeyValue(key, value));
    }

    // GET /kv/get?key=...
    @GetMapping("/get")
    public ResponseEntity<KeyValue> get(@RequestParam String key) {
        byte[] value = service.get(utf8(key));
        if (value == null) return ResponseEntity.notFound().build();
        return ResponseEntity.ok(new KeyValue(key, new String(value, StandardCharsets.UTF_8)));
    }

    // DELETE /kv/delete?key=...
    @DeleteMapping("/delete")
    public ResponseEntity<String> delete(@RequestParam String key) {
        boolean existed = service.delete(utf8(key));
        if (!existed) return ResponseEntity.status(404).body("Key not found");
        return ResponseEntity.ok("Deleted");
    }

    // GET /kv/stats -> {"size":..,"capacity":..}
    @GetMapping("/stats")
    public ResponseEntity<StoreStats> stats() {
        return ResponseEntity.ok(service.stats());
    }

    private static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
