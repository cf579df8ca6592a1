package com.ryuqq.world.application.world;

import com.ryuqq.world.application.heartbeat.Heartbeat;
import com.ryuqq.world.core.identity.IdentityAllocator;
import com.ryuqq.world.core.identity.IdentityConfig;
import com.ryuqq.world.core.model.MapDefinition;
import com.ryuqq.world.core.spi.GameCharacter;
import com.ryuqq.world.core.spi.Partition;
import com.ryuqq.world.core.spi.PartitionFactory;
import com.ryuqq.world.core.spi.PartitionIntegrityException;
import com.ryuqq.world.core.spi.PartitionRegistry;
import com.ryuqq.world.core.statemachine.HeartbeatState;
import com.ryuqq.world.testkit.contract.FakeCharacter;
import com.ryuqq.world.testkit.contract.FakePartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * WorldManager 유닛 테스트.
 *
 * <p>WorldManager의 조합 동작을 검증합니다:</p>
 * <ul>
 *   <li>레지스트리 적재 후 heartbeat 시작 (순서)</li>
 *   <li>무결성 오류 시 heartbeat 미시작</li>
 *   <li>Identity 발급</li>
 *   <li>조회 및 전역 질의 위임</li>
 * </ul>
 *
 * @author World Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class WorldManagerTest {

    @Mock
    private PartitionRegistry registry;

    @Mock
    private PartitionFactory partitionFactory;

    @Mock
    private Heartbeat heartbeat;

    private WorldManager worldManager;

    private final List<MapDefinition> definitions = List.of(
        new MapDefinition(1, "Harihara"),
        new MapDefinition(2, "Nuia")
    );

    @BeforeEach
    void setUp() {
        worldManager = new WorldManager(registry, partitionFactory, new IdentityAllocator(), heartbeat);
    }

    // ============================================================
    // 1. 초기화 순서
    // ============================================================

    @Test
    void initialize_레지스트리_적재_후_heartbeat_시작() {
        // given
        when(heartbeat.getState()).thenReturn(HeartbeatState.UNINITIALIZED);

        // when
        worldManager.initialize(definitions);

        // then
        InOrder inOrder = inOrder(registry, heartbeat);
        inOrder.verify(registry).initialize(definitions, partitionFactory);
        inOrder.verify(heartbeat).start(any(Runnable.class));
    }

    @Test
    void initialize_heartbeat_callback은_모든_partition_갱신() {
        // given
        ArgumentCaptor<Runnable> tick = ArgumentCaptor.forClass(Runnable.class);
        when(heartbeat.getState()).thenReturn(HeartbeatState.UNINITIALIZED);
        worldManager.initialize(definitions);
        verify(heartbeat).start(tick.capture());

        // when
        tick.getValue().run();
        tick.getValue().run();

        // then
        verify(registry, times(2)).advanceAll();
    }

    @Test
    void initialize_중복_id면_예외_전파_및_heartbeat_미시작() {
        // given
        when(heartbeat.getState()).thenReturn(HeartbeatState.UNINITIALIZED);
        doThrow(PartitionIntegrityException.duplicateId(1))
            .when(registry).initialize(definitions, partitionFactory);

        // when & then
        assertThatThrownBy(() -> worldManager.initialize(definitions))
            .isInstanceOf(PartitionIntegrityException.class)
            .hasMessageContaining("Duplicate map id: 1");

        verify(heartbeat, never()).start(any());
    }

    @Test
    void initialize_두번째_호출은_IllegalStateException_및_heartbeat_한번만_시작() {
        // given
        when(heartbeat.getState()).thenReturn(HeartbeatState.UNINITIALIZED);
        worldManager.initialize(definitions);
        doThrow(new IllegalStateException("Partition registry is already initialized"))
            .when(registry).initialize(definitions, partitionFactory);

        // when & then
        assertThatThrownBy(() -> worldManager.initialize(definitions))
            .isInstanceOf(IllegalStateException.class)
            .isNotInstanceOf(PartitionIntegrityException.class);

        verify(heartbeat, times(1)).start(any());
    }

    @Test
    void initialize_heartbeat가_이미_중지됐으면_레지스트리_미변경() {
        // given
        when(heartbeat.getState()).thenReturn(HeartbeatState.STOPPED);

        // when & then
        assertThatThrownBy(() -> worldManager.initialize(definitions))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("current: STOPPED");

        verify(registry, never()).initialize(any(), any());
        verify(heartbeat, never()).start(any());
    }

    // ============================================================
    // 2. Tick 처리
    // ============================================================

    @Test
    void updateEntities_실패한_partition이_있어도_예외_없이_완료() {
        // given
        when(registry.advanceAll()).thenReturn(2);

        // when & then
        assertThatCode(() -> worldManager.updateEntities()).doesNotThrowAnyException();
        verify(registry).advanceAll();
    }

    // ============================================================
    // 3. Identity 발급
    // ============================================================

    @Test
    void createHandle_1부터_순차_발급() {
        assertThat(worldManager.createHandle()).isEqualTo(1L);
        assertThat(worldManager.createHandle()).isEqualTo(2L);
        assertThat(worldManager.createHandle()).isEqualTo(3L);
    }

    @Test
    void createSessionObjectId_예약_범위에서_발급() {
        assertThat(worldManager.createSessionObjectId()).isEqualTo(0x0000E1A900000001L);
        assertThat(worldManager.createSessionObjectId()).isEqualTo(0x0000E1A900000002L);
    }

    @Test
    void createSkillObjectId_예약_범위에서_발급() {
        assertThat(worldManager.createSkillObjectId()).isEqualTo(0x000054B600000001L);
    }

    @Test
    void identity_종류별_카운터는_서로_독립() {
        // given
        worldManager.createHandle();
        worldManager.createHandle();

        // when
        long sessionObjectId = worldManager.createSessionObjectId();
        long handle = worldManager.createHandle();

        // then
        assertThat(sessionObjectId).isEqualTo(0x0000E1A900000001L);
        assertThat(handle).isEqualTo(3L);
    }

    @Test
    void identity_시작값_설정_적용() {
        // given
        IdentityConfig config = new IdentityConfig().withHandleStart(1000L);
        WorldManager configured = new WorldManager(registry, partitionFactory, new IdentityAllocator(config), heartbeat);

        // when & then
        assertThat(configured.createHandle()).isEqualTo(1001L);
    }

    // ============================================================
    // 4. 조회 위임
    // ============================================================

    @Test
    void getMap_id로_조회() {
        // given
        Partition partition = new FakePartition(1, "Harihara");
        when(registry.get(1)).thenReturn(Optional.of(partition));

        // when & then
        assertThat(worldManager.getMap(1)).containsSame(partition);
    }

    @Test
    void getMap_없는_name이면_empty() {
        // given
        when(registry.get("Unknown")).thenReturn(Optional.empty());

        // when & then
        assertThat(worldManager.getMap("Unknown")).isEmpty();
    }

    @Test
    void count_레지스트리_크기_반환() {
        // given
        when(registry.count()).thenReturn(2);

        // when & then
        assertThat(worldManager.count()).isEqualTo(2);
    }

    @Test
    void removeScriptedEntities_레지스트리에_위임() {
        // when
        worldManager.removeScriptedEntities();

        // then
        verify(registry).removeScriptedEntities();
    }

    @Test
    void getCharacterByTeamName_레지스트리에_위임() {
        // given
        GameCharacter character = new FakeCharacter(7L, "Aranzeb", "Nuian");
        when(registry.findCharacterByTeamName("Nuian")).thenReturn(Optional.of(character));

        // when & then
        assertThat(worldManager.getCharacterByTeamName("Nuian")).containsSame(character);
    }

    @Test
    void getCharacters_predicate_레지스트리에_위임() {
        // given
        GameCharacter character = new FakeCharacter(7L, "Aranzeb", "Nuian");
        Predicate<GameCharacter> predicate = c -> c.getHandle() == 7L;
        when(registry.allCharacters(predicate)).thenReturn(List.of(character));
        when(registry.allCharacters()).thenReturn(List.of(character));

        // when & then
        assertThat(worldManager.getCharacters(predicate)).containsExactly(character);
        assertThat(worldManager.getCharacters()).containsExactly(character);
    }

    // ============================================================
    // 5. 종료 및 생성자 검증
    // ============================================================

    @Test
    void shutdown_heartbeat_중지() {
        // when
        worldManager.shutdown();

        // then
        verify(heartbeat).stop();
    }

    @Test
    void 생성자_null_의존성이면_예외() {
        IdentityAllocator allocator = new IdentityAllocator();

        assertThatThrownBy(() -> new WorldManager(null, partitionFactory, allocator, heartbeat))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("registry cannot be null");
        assertThatThrownBy(() -> new WorldManager(registry, null, allocator, heartbeat))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("partitionFactory cannot be null");
        assertThatThrownBy(() -> new WorldManager(registry, partitionFactory, null, heartbeat))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("identityAllocator cannot be null");
        assertThatThrownBy(() -> new WorldManager(registry, partitionFactory, allocator, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("heartbeat cannot be null");
    }
}
