package world.willfrog.storeagent.controller;

import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;
import world.willfrog.storeagent.common.dto.ResponseWrapper;
import world.willfrog.storeagent.dto.RunOutcome;
import world.willfrog.storeagent.dto.StoreAgentUpdateRequest;
import world.willfrog.storeagent.dto.StoreAgentView;
import world.willfrog.storeagent.service.StoreAgentSettingsService;

import java.util.List;

@RestController
@RequestMapping("/api/store-agents")
public class StoreAgentController {

    private final StoreAgentSettingsService settingsService;

    public StoreAgentController(StoreAgentSettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @GetMapping
    public ResponseWrapper<List<StoreAgentView>> list(@RequestHeader("X-Store-Id") Long storeId) {
        return ResponseWrapper.success(settingsService.list(storeId));
    }

    @GetMapping("/{slug}")
    public ResponseWrapper<StoreAgentView> detail(
            @RequestHeader("X-Store-Id") Long storeId,
            @PathVariable("slug") String slug) {
        return ResponseWrapper.success(settingsService.detail(storeId, slug));
    }

    @PutMapping("/{slug}")
    public ResponseWrapper<StoreAgentView> update(
            @RequestHeader("X-Store-Id") Long storeId,
            @PathVariable("slug") String slug,
            @Valid @RequestBody StoreAgentUpdateRequest request) {
        return ResponseWrapper.success(settingsService.update(storeId, slug, request));
    }

    @PostMapping("/{slug}/run")
    public ResponseWrapper<RunOutcome> run(
            @RequestHeader("X-Store-Id") Long storeId,
            @PathVariable("slug") String slug) {
        return ResponseWrapper.success(settingsService.runNow(storeId, slug));
    }
}
