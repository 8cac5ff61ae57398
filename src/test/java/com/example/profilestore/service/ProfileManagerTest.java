package com.example.profilestore.service;

import com.example.profilestore.config.ProfileStoreProperties;
import com.example.profilestore.model.ProfileMetadata;
import com.example.profilestore.profile.LockState;
import com.example.profilestore.profile.MutableClock;
import com.example.profilestore.profile.OwnerHandle;
import com.example.profilestore.profile.Profile;
import com.example.profilestore.profile.ProfileCodec;
import com.example.profilestore.profile.ProfileOptions;
import com.example.profilestore.profile.ProfileStore;
import com.example.profilestore.profile.ProfileTemplate;
import com.example.profilestore.profile.SaveSink;
import com.example.profilestore.profile.VersionLedger;
import com.example.profilestore.store.InMemoryRemoteStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProfileManagerTest {

    @Mock
    private AutosaveScheduler autosave;

    private InMemoryRemoteStore remote;
    private ProfileCodec codec;
    private MutableClock clock;
    private ProfileOptions options;
    private ProfileStoreProperties properties;
    private ProfileManager manager;

    @BeforeEach
    void setUp() {
        remote = new InMemoryRemoteStore();
        codec = new ProfileCodec(new ObjectMapper());
        clock = new MutableClock(5_000L);
        options = ProfileOptions.builder()
                .template(ProfileTemplate.of(Map.of("coins", 0, "inventory", Map.of("weapons", List.of()))))
                .sessionCheckInterval(Duration.ofMillis(10))
                .maxConnectionAttemptDelay(Duration.ZERO)
                .build();
        properties = new ProfileStoreProperties();
        manager = new ProfileManager(storeFor("server-a"), autosave, properties);
    }

    private ProfileStore storeFor(String token) {
        return new ProfileStore(remote, options, codec, SaveSink.NONE, clock, token);
    }

    private ProfileMetadata latestStored(String ownerId) {
        VersionLedger ledger = storeFor("any").ledgerFor(ownerId);
        long latest = ledger.latestVersion().orElseThrow();
        return codec.decode(remote.get(ledger.documentsName(), Long.toString(latest)).orElseThrow());
    }

    @Test
    void testAttach_LoadsRegistersAndSchedulesAutosave() {
        Profile profile = manager.attach("p1");

        assertEquals(LockState.LOCKED, profile.getState());
        assertSame(profile, manager.find("p1").orElseThrow());
        assertEquals(1, manager.liveProfiles().size());
        verify(autosave).schedule(profile);
    }

    @Test
    void testAttach_SameOwnerReturnsTheLiveProfile() {
        Profile first = manager.attach("p1");
        Profile second = manager.attach("p1");

        assertSame(first, second);
        verify(autosave, times(1)).schedule(any());
    }

    @Test
    void testAttach_RejectsMissingOwner() {
        assertThrows(IllegalArgumentException.class, () -> manager.attach(null));
        assertThrows(IllegalArgumentException.class, () -> manager.attach(" "));
        verifyNoInteractions(autosave);
    }

    @Test
    void testAttach_ReconcilesOldDocumentsAgainstTemplate() {
        ProfileStore oldShape = new ProfileStore(remote,
                options.toBuilder().template(ProfileTemplate.of(Map.of("coins", 3))).build(),
                codec, SaveSink.NONE, clock, "old-server");
        Profile old = oldShape.load(new OwnerHandle("p1"));
        oldShape.release(old);

        Profile profile = manager.attach("p1");

        assertEquals(3, profile.get("coins"));
        assertEquals(List.of(), profile.get("inventory.weapons"));
    }

    @Test
    void testAttach_WithoutReconcileKeepsDocumentAsStored() {
        ProfileStore oldShape = new ProfileStore(remote,
                options.toBuilder().template(ProfileTemplate.of(Map.of("coins", 3))).build(),
                codec, SaveSink.NONE, clock, "old-server");
        oldShape.release(oldShape.load(new OwnerHandle("p1")));
        properties.setReconcileOnLoad(false);
        ProfileManager plain = new ProfileManager(storeFor("server-a"), autosave, properties);

        Profile profile = plain.attach("p1");

        assertNull(profile.get("inventory"));
    }

    @Test
    void testDetach_ReleasesLockWithFinalSave() {
        Profile profile = manager.attach("p1");
        profile.set("coins", 12);

        assertTrue(manager.detach("p1"));

        assertEquals(LockState.UNLOCKED, profile.getState());
        assertTrue(profile.teardown().isDone());
        assertTrue(manager.find("p1").isEmpty());
        ProfileMetadata stored = latestStored("p1");
        assertNull(stored.getSessionData());
        assertEquals(12, stored.getData().get("coins"));
        assertFalse(manager.detach("p1"));
    }

    @Test
    void testDetach_DuringLockWaitCancelsTheLoad() throws Exception {
        ProfileStore other = storeFor("server-b");
        other.load(new OwnerHandle("p1"));
        int listCalls = remote.listCalls.get();
        int writes = remote.writeAttempts();

        CompletableFuture<Profile> attaching = CompletableFuture.supplyAsync(() -> manager.attach("p1"));
        long deadline = System.currentTimeMillis() + 5000;
        while (remote.listCalls.get() < listCalls + 2 && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }

        assertTrue(manager.detach("p1"));
        Profile profile = attaching.get(5, TimeUnit.SECONDS);

        assertEquals(LockState.DEGRADED, profile.getState());
        assertTrue(manager.find("p1").isEmpty());
        assertEquals(writes, remote.writeAttempts());
        verify(autosave, never()).schedule(any());
        assertEquals("server-b", latestStored("p1").getSessionData().getOwnerToken());
    }

    @Test
    void testAttach_WaitsOutCancelledLoadBeforeClaimingAgain() throws Exception {
        CountDownLatch claimPublished = new CountDownLatch(1);
        CountDownLatch resume = new CountDownLatch(1);
        AtomicBoolean holdNextAppend = new AtomicBoolean(true);
        InMemoryRemoteStore gated = new InMemoryRemoteStore() {
            @Override
            public void putOrdered(String name, String key, long value) {
                super.putOrdered(name, key, value);
                if (holdNextAppend.compareAndSet(true, false)) {
                    claimPublished.countDown();
                    try {
                        resume.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            }
        };
        ProfileStore store = new ProfileStore(gated, options, codec, SaveSink.NONE, clock, "server-a");
        ProfileManager gatedManager = new ProfileManager(store, autosave, properties);

        CompletableFuture<Profile> first = CompletableFuture.supplyAsync(() -> gatedManager.attach("p1"));
        assertTrue(claimPublished.await(5, TimeUnit.SECONDS));

        assertTrue(gatedManager.detach("p1"));
        assertThrows(IllegalStateException.class, () -> gatedManager.attach("p1"));

        resume.countDown();
        Profile cancelled = first.get(5, TimeUnit.SECONDS);
        assertEquals(LockState.UNLOCKED, cancelled.getState());

        Profile second = gatedManager.attach("p1");
        assertEquals(LockState.LOCKED, second.getState());
        assertEquals(2, second.getSessions());
        VersionLedger ledger = store.ledgerFor("p1");
        ProfileMetadata latest = codec.decode(gated.get(ledger.documentsName(),
                Long.toString(ledger.latestVersion().orElseThrow())).orElseThrow());
        assertEquals("server-a", latest.getSessionData().getOwnerToken());
        verify(autosave, times(1)).schedule(second);
    }

    @Test
    void testShutdown_ReleasesEveryProfile() {
        Profile a = manager.attach("a");
        Profile b = manager.attach("b");

        manager.shutdown();

        assertEquals(LockState.UNLOCKED, a.getState());
        assertEquals(LockState.UNLOCKED, b.getState());
        assertTrue(manager.liveProfiles().isEmpty());
        assertNull(latestStored("a").getSessionData());
        assertNull(latestStored("b").getSessionData());
    }
}
