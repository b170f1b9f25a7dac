package com.kmg.extract.api;

import com.kmg.extract.dto.BacklogView;
import com.kmg.extract.model.BacklogEntry;
import com.kmg.extract.service.BacklogService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/backlog")
public class BacklogController {
    private final BacklogService backlogService;

    public BacklogController(BacklogService backlogService) {
        this.backlogService = backlogService;
    }

    @GetMapping
    public BacklogView backlog(@RequestParam("path") String path) {
        String dir = backlogService.normalizeFolderPath(path).toString();
        List<BacklogEntry> items = backlogService.listBacklog(dir);
        return new BacklogView(dir, items.size(), items);
    }
}
