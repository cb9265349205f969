package com.example.healthrag;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/admin")
public class AdminController {

    @Autowired
    private VectorIndex vectorIndex;

    @Autowired
    private MemoryStore memoryStore;

    @Value("${hnsw.persist.path:./data/vector-index.idx}")
    private String defaultPersistPath;

    @PostMapping("/index/rebuild")
    public String rebuild() {
        try {
            vectorIndex.rebuildFromDatabase();
            return "rebuild finished, size=" + vectorIndex.size();
        } catch (Exception e) {
            return "rebuild failed: " + e.getMessage();
        }
    }

    @PostMapping("/index/persist")
    public String persist(@RequestParam(name = "path", required = false) String path) {
        try {
            Path p = Path.of(path != null ? path : defaultPersistPath);
            if (p.getParent() != null) Files.createDirectories(p.getParent());
            vectorIndex.persistTo(p);
            return "persisted to " + p.toAbsolutePath();
        } catch (Exception e) {
            return "persist failed: " + e.getMessage();
        }
    }

    @PostMapping("/index/load")
    public String load(@RequestParam(name = "path", required = false) String path) {
        try {
            Path p = Path.of(path != null ? path : defaultPersistPath);
            vectorIndex.loadFrom(p);
            return "loaded from " + p.toAbsolutePath() + ", size=" + vectorIndex.size();
        } catch (Exception e) {
            return "load failed: " + e.getMessage();
        }
    }

    @GetMapping("/index/params")
    public Map<String, Object> getParams() {
        if (vectorIndex instanceof HnswVectorIndex) {
            return ((HnswVectorIndex) vectorIndex).getHnswParams();
        }
        return Collections.emptyMap();
    }

    @PostMapping("/index/params")
    public String setParams(@RequestParam int m, @RequestParam int efConstruction, @RequestParam int ef) {
        if (!(vectorIndex instanceof HnswVectorIndex)) return "not hnsw implementation";
        if (m <= 0 || efConstruction <= 0 || ef <= 0) throw new IllegalArgumentException("m, efConstruction and ef must be positive");
        ((HnswVectorIndex) vectorIndex).reconfigure(m, efConstruction, ef);
        return "reconfigured";
    }

    @GetMapping("/index/status")
    public Map<String, Object> status() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("implementation", vectorIndex.getClass().getSimpleName());
        out.put("size", vectorIndex.size());
        if (vectorIndex instanceof HnswVectorIndex) {
            HnswVectorIndex h = (HnswVectorIndex) vectorIndex;
            out.put("dimensions", h.getDimensions());
            out.put("graphPartitions", h.graphPartitionCount());
            out.put("params", h.getHnswParams());
            out.put("persist", h.getLastPersistInfo());
        }
        return out;
    }

    @PostMapping("/memory/prune")
    public Map<String, Object> pruneMemories(@RequestParam(name = "olderThanDays", defaultValue = "90") int olderThanDays) {
        return Collections.singletonMap("pruned", memoryStore.pruneOlderThan(olderThanDays));
    }
}
