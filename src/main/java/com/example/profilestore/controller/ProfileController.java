package com.example.profilestore.controller;

import com.example.profilestore.profile.Profile;
import com.example.profilestore.service.ProfileManager;
import com.example.profilestore.service.ProfileViews;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * HTTP surface over {@link ProfileManager}. Loading can block on another server's
 * session lock, so every call runs on the bounded-elastic scheduler.
 */
@RestController
@RequestMapping("/profiles")
public class ProfileController {

    private final ProfileManager profileManager;

    public ProfileController(ProfileManager profileManager) {
        this.profileManager = profileManager;
    }

    @GetMapping
    public Mono<List<Map<String, Object>>> list() {
        return blocking(() -> profileManager.liveProfiles().stream().map(ProfileViews::status).toList());
    }

    @PostMapping("/{ownerId}")
    public Mono<Map<String, Object>> attach(@PathVariable String ownerId) {
        return blocking(() -> {
            try {
                return ProfileViews.status(profileManager.attach(ownerId));
            } catch (IllegalStateException e) {
                throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage(), e);
            }
        });
    }

    @DeleteMapping("/{ownerId}")
    public Mono<ResponseEntity<Void>> detach(@PathVariable String ownerId) {
        return blocking(() -> profileManager.detach(ownerId)
                ? ResponseEntity.noContent().<Void>build()
                : ResponseEntity.notFound().<Void>build());
    }

    @GetMapping("/{ownerId}")
    public Mono<Map<String, Object>> get(@PathVariable String ownerId, @RequestParam(required = false) String path) {
        return blocking(() -> ProfileViews.value(ownerId, path, live(ownerId).get(path)));
    }

    @PutMapping("/{ownerId}")
    public Mono<Map<String, Object>> set(@PathVariable String ownerId,
                                         @RequestParam String path,
                                         @RequestBody(required = false) Object value) {
        return blocking(() -> {
            Profile profile = live(ownerId);
            if (!profile.set(path, value)) {
                throw new ResponseStatusException(HttpStatus.CONFLICT, "Path " + path + " does not fit the document");
            }
            return ProfileViews.value(ownerId, path, profile.get(path));
        });
    }

    @PostMapping("/{ownerId}/increment")
    public Mono<Map<String, Object>> increment(@PathVariable String ownerId,
                                               @RequestParam String path,
                                               @RequestParam long delta) {
        return blocking(() -> {
            Profile profile = live(ownerId);
            if (!profile.increment(path, delta)) {
                throw new ResponseStatusException(HttpStatus.CONFLICT, "Value at " + path + " is not numeric");
            }
            return ProfileViews.value(ownerId, path, profile.get(path));
        });
    }

    @PostMapping("/{ownerId}/save")
    public Mono<Map<String, Object>> save(@PathVariable String ownerId) {
        return blocking(() -> {
            Profile profile = live(ownerId);
            Map<String, Object> status = ProfileViews.status(profile);
            status.put("saved", profile.save());
            return status;
        });
    }

    private Profile live(String ownerId) {
        return profileManager.find(ownerId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Profile " + ownerId + " is not attached"));
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
