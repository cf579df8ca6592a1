package com.ryuqq.world.application.world;

import com.ryuqq.world.application.heartbeat.Heartbeat;
import com.ryuqq.world.core.identity.IdentityAllocator;
import com.ryuqq.world.core.identity.IdentityKind;
import com.ryuqq.world.core.model.MapDefinition;
import com.ryuqq.world.core.spi.GameCharacter;
import com.ryuqq.world.core.spi.Partition;
import com.ryuqq.world.core.spi.PartitionFactory;
import com.ryuqq.world.core.spi.PartitionIntegrityException;
import com.ryuqq.world.core.spi.PartitionRegistry;
import com.ryuqq.world.core.statemachine.HeartbeatState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * World manager.
 *
 * <p>Composition root of the world core: wires the partition registry, the identity allocator
 * and the heartbeat together and exposes their combined contract to the session layer, the
 * script subsystem and the game loop.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>월드 초기화: 레지스트리 적재 후 heartbeat 시작 (순서 보장)</li>
 *   <li>Handle / session object id / skill object id 발급</li>
 *   <li>Map 조회 및 레지스트리 전역 질의 위임</li>
 *   <li>Heartbeat tick마다 모든 Partition 갱신</li>
 * </ul>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * initialize(definitions)
 *   ↓
 * heartbeat 상태 확인 (UNINITIALIZED가 아니면 레지스트리 변경 없이 실패)
 *   ↓
 * registry.initialize(definitions, factory)   // 실패 시 heartbeat 시작 안 함
 *   ↓
 * heartbeat.start(this::updateEntities)
 *   ↓ (매 tick)
 * registry.advanceAll()
 * </pre>
 *
 * <p>All methods are thread-safe; thread-safety comes from the registry's guard and the
 * allocator's atomic counters.</p>
 *
 * @author World Team
 * @since 1.0.0
 */
public class WorldManager {

    private static final Logger log = LoggerFactory.getLogger(WorldManager.class);

    private final PartitionRegistry registry;
    private final PartitionFactory partitionFactory;
    private final IdentityAllocator identityAllocator;
    private final Heartbeat heartbeat;

    /**
     * 생성자.
     *
     * @param registry partition 레지스트리
     * @param partitionFactory map 정의로부터 partition 생성
     * @param identityAllocator identity 발급기
     * @param heartbeat heartbeat 스케줄러
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public WorldManager(PartitionRegistry registry, PartitionFactory partitionFactory,
                        IdentityAllocator identityAllocator, Heartbeat heartbeat) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (partitionFactory == null) {
            throw new IllegalArgumentException("partitionFactory cannot be null");
        }
        if (identityAllocator == null) {
            throw new IllegalArgumentException("identityAllocator cannot be null");
        }
        if (heartbeat == null) {
            throw new IllegalArgumentException("heartbeat cannot be null");
        }
        this.registry = registry;
        this.partitionFactory = partitionFactory;
        this.identityAllocator = identityAllocator;
        this.heartbeat = heartbeat;
    }

    /**
     * 월드 초기화.
     *
     * <p>Populates the registry, then starts the heartbeat, so the first tick never sees a
     * partially populated registry.</p>
     *
     * @param definitions map definitions
     * @throws PartitionIntegrityException 정의에 id 또는 name 중복이 있는 경우 (heartbeat 미시작)
     * @throws IllegalStateException 이미 초기화된 경우, 또는 heartbeat가 이미 시작/중지된 경우 (레지스트리 미변경)
     */
    public void initialize(Collection<MapDefinition> definitions) {
        HeartbeatState heartbeatState = heartbeat.getState();
        if (heartbeatState != HeartbeatState.UNINITIALIZED) {
            throw new IllegalStateException(
                "Heartbeat must be UNINITIALIZED before world initialization (current: " + heartbeatState + ")"
            );
        }

        try {
            registry.initialize(definitions, partitionFactory);
        } catch (PartitionIntegrityException e) {
            log.error("World initialization aborted: {}", e.getMessage());
            throw e;
        }

        heartbeat.start(this::updateEntities);
        log.info("World initialized: {} maps, heartbeat {}", registry.count(), heartbeat.getState());
    }

    /**
     * Heartbeat tick callback: advances every partition by one step.
     */
    public void updateEntities() {
        int failed = registry.advanceAll();
        if (failed > 0) {
            log.warn("Heartbeat tick completed with {} failing partitions", failed);
        } else {
            log.debug("Heartbeat tick completed");
        }
    }

    /**
     * Returns a new handle to be used for a character or monster.
     *
     * @return new actor handle
     */
    public long createHandle() {
        return identityAllocator.next(IdentityKind.HANDLE);
    }

    /**
     * Returns a new object id that can be used for a session object.
     *
     * @return new session object id
     */
    public long createSessionObjectId() {
        return identityAllocator.next(IdentityKind.SESSION_OBJECT);
    }

    /**
     * Returns a new object id that can be used for a skill object.
     *
     * @return new skill object id
     */
    public long createSkillObjectId() {
        return identityAllocator.next(IdentityKind.SKILL_OBJECT);
    }

    /**
     * @return number of maps in the world
     */
    public int count() {
        return registry.count();
    }

    /**
     * Returns map by id.
     *
     * @param mapId map id
     * @return map, or empty if it doesn't exist
     */
    public Optional<Partition> getMap(int mapId) {
        return registry.get(mapId);
    }

    /**
     * Returns map by name.
     *
     * @param mapName map name
     * @return map, or empty if it doesn't exist
     */
    public Optional<Partition> getMap(String mapName) {
        return registry.get(mapName);
    }

    /**
     * Removes all scripted entities, like NPCs.
     */
    public void removeScriptedEntities() {
        registry.removeScriptedEntities();
    }

    /**
     * Returns the first character found with the given team name.
     *
     * @param teamName team name
     * @return character, or empty if none were found
     */
    public Optional<GameCharacter> getCharacterByTeamName(String teamName) {
        return registry.findCharacterByTeamName(teamName);
    }

    /**
     * @return all characters that are currently online
     */
    public List<GameCharacter> getCharacters() {
        return registry.allCharacters();
    }

    /**
     * Returns all online characters that match the given predicate.
     *
     * @param predicate character filter
     * @return matching characters
     */
    public List<GameCharacter> getCharacters(Predicate<GameCharacter> predicate) {
        return registry.allCharacters(predicate);
    }

    /**
     * Stops the heartbeat. Called at process teardown.
     */
    public void shutdown() {
        heartbeat.stop();
        log.info("World shut down after {} heartbeat ticks ({} failed)",
            heartbeat.getTickCount(), heartbeat.getFailedTickCount());
    }
}
