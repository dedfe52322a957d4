package org.operaton.nostrpub.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.operaton.nostrpub.TestFixtures;
import org.operaton.nostrpub.cache.BridgeCache;
import org.operaton.nostrpub.config.NostrPubProperties;
import org.operaton.nostrpub.exception.StoreUnavailableException;
import org.operaton.nostrpub.model.entity.FollowerEntry;
import org.operaton.nostrpub.model.entity.VirtualActor;
import org.operaton.nostrpub.model.nostr.NativeIdentity;
import org.operaton.nostrpub.model.nostr.ProfileMetadata;
import org.operaton.nostrpub.security.HttpSignatureValidator;
import org.operaton.nostrpub.security.NostrKeys;
import org.operaton.nostrpub.store.InMemoryBridgeStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdentityMapperTest {

    private static final String REMOTE_ACTOR = "https://mastodon.example/users/bob";

    private final NativeIdentity alice = NativeIdentity.fromHex(TestFixtures.pubkeyOf(TestFixtures.ALICE_KEY));

    private InMemoryBridgeStore store;
    private BridgeCache cache;
    private NostrKeys nostrKeys;
    private IdentityMapper identityMapper;

    @BeforeEach
    void setUp() {
        NostrPubProperties properties = TestFixtures.properties();
        store = new InMemoryBridgeStore();
        cache = new BridgeCache(properties);
        nostrKeys = new NostrKeys(properties);
        identityMapper = new IdentityMapper(store, cache, new BridgeUris(properties), nostrKeys,
            new HttpSignatureValidator(properties, TestFixtures.clock()), TestFixtures.clock());
    }

    // ==================== Virtual Actor Tests ====================

    @Test
    void resolveOrCreate_calledConcurrently_shouldCreateExactlyOneActor() throws Exception {
        int callers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<VirtualActor>> results = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return identityMapper.resolveOrCreate(alice);
                }));
            }
            start.countDown();

            Set<String> privateKeys = new HashSet<>();
            for (Future<VirtualActor> result : results) {
                privateKeys.add(result.get(30, TimeUnit.SECONDS).getPrivateKey());
            }

            assertThat(privateKeys).hasSize(1);
            assertThat(store.createVirtualActorCalls()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void resolveOrCreate_shouldDeriveActorFieldsFromKey() {
        VirtualActor actor = identityMapper.resolveOrCreate(alice);

        assertThat(actor.getActorUri()).isEqualTo("https://bridge.example/users/" + alice.npub());
        assertThat(actor.getPreferredUsername()).isEqualTo(alice.npub());
        assertThat(actor.getPublicKey()).startsWith("-----BEGIN PUBLIC KEY-----");
        assertThat(actor.getKeyId()).isEqualTo(actor.getActorUri() + "#main-key");
    }

    @Test
    void resolveOrCreate_withCachedProfile_shouldApplyItOnCreation() {
        identityMapper.updateProfile(alice, ProfileMetadata.builder()
            .name("alice")
            .displayName("Alice")
            .about("hi")
            .picture("https://img.example/alice.png")
            .build());

        VirtualActor actor = identityMapper.resolveOrCreate(alice);

        assertThat(actor.getDisplayName()).isEqualTo("Alice");
        assertThat(actor.getSummary()).isEqualTo("hi");
        assertThat(actor.getAvatarUrl()).isEqualTo("https://img.example/alice.png");
    }

    @Test
    void updateProfile_withExistingActor_shouldRewriteDisplayFields() {
        identityMapper.resolveOrCreate(alice);

        identityMapper.updateProfile(alice, ProfileMetadata.builder().name("al").build());

        assertThat(identityMapper.resolveOrCreate(alice).getDisplayName()).isEqualTo("al");
    }

    // ==================== Remote Identity Tests ====================

    @Test
    void resolveOrCreate_withBridgeActorUri_shouldDecodeKeyWithoutStoring() {
        NativeIdentity identity = identityMapper.resolveOrCreate(
            "https://bridge.example/users/" + alice.npub() + "#main-key");

        assertThat(identity).isEqualTo(alice);
        assertThat(store.isEmpty()).isTrue();
    }

    @Test
    void resolveOrCreate_withRemoteActor_shouldRecordDerivedKeyOnce() {
        NativeIdentity first = identityMapper.resolveOrCreate(REMOTE_ACTOR);
        NativeIdentity second = identityMapper.resolveOrCreate(REMOTE_ACTOR);

        assertThat(first).isEqualTo(nostrKeys.derivedIdentity(REMOTE_ACTOR)).isEqualTo(second);
        assertThat(identityMapper.remoteIdentityOf(first))
            .hasValueSatisfying(identity -> assertThat(identity.getDomain()).isEqualTo("mastodon.example"));
    }

    // ==================== Follower Tests ====================

    @Test
    void removeFollower_fromRelayAfterFederationFollow_shouldKeepFollow() {
        NativeIdentity bob = identityMapper.resolveOrCreate(REMOTE_ACTOR);
        identityMapper.addFollower(alice, bob, REMOTE_ACTOR, "https://mastodon.example/follows/1",
            FollowerEntry.Source.FEDERATION, TestFixtures.NOW);

        boolean removed = identityMapper.removeFollower(alice, bob, FollowerEntry.Source.RELAY,
            TestFixtures.NOW.plusSeconds(60));

        assertThat(removed).isFalse();
        assertThat(identityMapper.federatedFollowerCount(alice)).isEqualTo(1);
    }

    @Test
    void removeFollower_fromFederation_shouldDeactivate() {
        NativeIdentity bob = identityMapper.resolveOrCreate(REMOTE_ACTOR);
        identityMapper.addFollower(alice, bob, REMOTE_ACTOR, null, FollowerEntry.Source.FEDERATION, TestFixtures.NOW);

        assertThat(identityMapper.removeFollower(alice, bob, FollowerEntry.Source.FEDERATION, TestFixtures.NOW))
            .isTrue();
        assertThat(identityMapper.followers(alice)).isEmpty();
    }

    @Test
    void addFollower_twice_shouldReportOnlyFirstActivation() {
        NativeIdentity bob = identityMapper.resolveOrCreate(REMOTE_ACTOR);

        assertThat(identityMapper.addFollower(alice, bob, REMOTE_ACTOR, null, FollowerEntry.Source.FEDERATION,
            TestFixtures.NOW)).isTrue();
        assertThat(identityMapper.addFollower(alice, bob, REMOTE_ACTOR, null, FollowerEntry.Source.FEDERATION,
            TestFixtures.NOW)).isFalse();
    }

    @Test
    void addFollower_calledConcurrently_shouldActivateExactlyOnce() throws Exception {
        NativeIdentity bob = identityMapper.resolveOrCreate(REMOTE_ACTOR);
        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return identityMapper.addFollower(alice, bob, REMOTE_ACTOR, null,
                        FollowerEntry.Source.FEDERATION, TestFixtures.NOW);
                }));
            }
            start.countDown();
            int activations = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    activations++;
                }
            }
            assertThat(activations).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
        assertThat(identityMapper.followers(alice)).hasSize(1);
    }

    @Test
    void addFollower_fromRelayRacingFederationFollow_shouldRereadAndKeepFederationEntry() {
        AtomicBoolean raced = new AtomicBoolean();
        InMemoryBridgeStore racingStore = new InMemoryBridgeStore() {
            @Override
            public boolean compareAndSaveFollowerEntry(FollowerEntry entry) {
                if (raced.compareAndSet(false, true)) {
                    super.compareAndSaveFollowerEntry(FollowerEntry.builder()
                        .followedPubkey(entry.getFollowedPubkey())
                        .followerPubkey(entry.getFollowerPubkey())
                        .followerActorUri(REMOTE_ACTOR)
                        .source(FollowerEntry.Source.FEDERATION)
                        .active(true)
                        .updatedAt(TestFixtures.NOW)
                        .build());
                }
                return super.compareAndSaveFollowerEntry(entry);
            }
        };
        NostrPubProperties properties = TestFixtures.properties();
        IdentityMapper mapper = new IdentityMapper(racingStore, new BridgeCache(properties), new BridgeUris(properties),
            nostrKeys, new HttpSignatureValidator(properties, TestFixtures.clock()), TestFixtures.clock());
        NativeIdentity bob = mapper.resolveOrCreate(REMOTE_ACTOR);

        boolean added = mapper.addFollower(alice, bob, null, null, FollowerEntry.Source.RELAY,
            TestFixtures.NOW.minusSeconds(60));

        assertThat(added).isFalse();
        assertThat(racingStore.findFollowerEntry(alice.hex(), bob.hex())).hasValueSatisfying(entry -> {
            assertThat(entry.getSource()).isEqualTo(FollowerEntry.Source.FEDERATION);
            assertThat(entry.getFollowerActorUri()).isEqualTo(REMOTE_ACTOR);
            assertThat(entry.getUpdatedAt()).isEqualTo(TestFixtures.NOW);
        });
    }

    @Test
    void addFollower_whenPairNeverSettles_shouldFailWithStoreUnavailable() {
        InMemoryBridgeStore contendedStore = new InMemoryBridgeStore() {
            @Override
            public boolean compareAndSaveFollowerEntry(FollowerEntry entry) {
                return false;
            }
        };
        NostrPubProperties properties = TestFixtures.properties();
        IdentityMapper mapper = new IdentityMapper(contendedStore, new BridgeCache(properties), new BridgeUris(properties),
            nostrKeys, new HttpSignatureValidator(properties, TestFixtures.clock()), TestFixtures.clock());
        NativeIdentity bob = mapper.resolveOrCreate(REMOTE_ACTOR);

        assertThatThrownBy(() -> mapper.addFollower(alice, bob, REMOTE_ACTOR, null,
            FollowerEntry.Source.FEDERATION, TestFixtures.NOW))
            .isInstanceOf(StoreUnavailableException.class)
            .hasMessageContaining("kept changing");
    }

    @Test
    void applyFollowList_shouldAddAndRemoveRelayFollows() {
        NativeIdentity bob = identityMapper.resolveOrCreate(REMOTE_ACTOR);
        NativeIdentity carol = identityMapper.resolveOrCreate("https://other.example/users/carol");
        Instant first = TestFixtures.NOW;

        IdentityMapper.FollowListChange initial = identityMapper.applyFollowList(alice, List.of(bob, carol), first);
        IdentityMapper.FollowListChange next = identityMapper.applyFollowList(alice, List.of(carol), first.plusSeconds(10));

        assertThat(initial.getAdded()).containsExactlyInAnyOrder(bob, carol);
        assertThat(next.getAdded()).isEmpty();
        assertThat(next.getRemoved()).containsExactly(bob);
        assertThat(identityMapper.following(alice).stream().map(FollowerEntry::getFollowedPubkey)
            .collect(Collectors.toList())).containsExactly(carol.hex());
    }

    @Test
    void applyFollowList_olderThanLastChange_shouldBeIgnored() {
        NativeIdentity bob = identityMapper.resolveOrCreate(REMOTE_ACTOR);
        identityMapper.applyFollowList(alice, List.of(bob), TestFixtures.NOW);

        IdentityMapper.FollowListChange stale =
            identityMapper.applyFollowList(alice, List.of(), TestFixtures.NOW.minusSeconds(60));

        assertThat(stale.isEmpty()).isTrue();
        assertThat(identityMapper.following(alice)).hasSize(1);
    }
}
