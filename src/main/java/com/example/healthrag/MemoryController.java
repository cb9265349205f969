package com.example.healthrag;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.http.ResponseEntity;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/memory")
public class MemoryController {

    @Autowired
    private MemoryStore memoryStore;

    @GetMapping("/{ownerId}")
    public ResponseEntity<ApiModels.MemoryResponse> get(@PathVariable String ownerId) {
        return memoryStore.get(ownerId).map(ApiModels.MemoryResponse::of)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{ownerId}")
    public ApiModels.MemoryResponse append(@PathVariable String ownerId, @RequestBody ApiModels.MemoryAppendRequest req) {
        return ApiModels.MemoryResponse.of(memoryStore.append(ownerId, req.getText(), req.getContext()));
    }

    @GetMapping("/{ownerId}/entries")
    public List<ApiModels.MemoryEntryView> entries(@PathVariable String ownerId) {
        List<ApiModels.MemoryEntryView> out = new ArrayList<>();
        for (MemoryEntry e : memoryStore.extractEntries(ownerId)) out.add(ApiModels.MemoryEntryView.of(e));
        return out;
    }
}
