package org.hivemind.runtime;

import java.io.File;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.hivemind.config.ConfigLoader;
import org.hivemind.runtime.behavior.AiContext;
import org.hivemind.runtime.behavior.BehaviorStateMachine;
import org.hivemind.runtime.behavior.ContextBuilder;
import org.hivemind.runtime.behavior.StatModifierChain;
import org.hivemind.runtime.behavior.StateActions;
import org.hivemind.runtime.behavior.tree.BehaviorNode;
import org.hivemind.runtime.events.AiEventTypes;
import org.hivemind.runtime.events.PathfindingStatsEvent;
import org.hivemind.runtime.events.StateChangedEvent;
import org.hivemind.runtime.events.SystemInitializedEvent;
import org.hivemind.runtime.model.Agent;
import org.hivemind.runtime.model.AgentState;
import org.hivemind.runtime.model.Vector2;
import org.hivemind.runtime.model.component.AiComponent;
import org.hivemind.runtime.model.component.Health;
import org.hivemind.runtime.model.component.Movement;
import org.hivemind.runtime.model.component.Transform;
import org.hivemind.runtime.movement.MovementExecutor;
import org.hivemind.runtime.pathfinding.FlowFieldCache;
import org.hivemind.runtime.pathfinding.PathCache;
import org.hivemind.runtime.pathfinding.PathRequest;
import org.hivemind.runtime.pathfinding.PathRequestQueue;
import org.hivemind.runtime.pathfinding.PathfindingService;
import org.hivemind.runtime.pathfinding.PathfindingStrategyFactory;
import org.hivemind.runtime.pathfinding.impl.DirectPathStrategy;
import org.hivemind.runtime.pathfinding.navmesh.NavMesh;
import org.hivemind.runtime.spatial.SpatialHashGrid;
import org.hivemind.runtime.spi.IEntity;
import org.hivemind.runtime.spi.IEventSink;
import org.hivemind.runtime.spi.IObstacleMap;
import org.hivemind.runtime.spi.IStatModifier;
import org.hivemind.runtime.spi.IWorld;
import org.hivemind.runtime.spi.pathfinding.IPathfindingStrategy;
import org.hivemind.runtime.spi.pathfinding.PathfindingEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

/**
 * Drives every AI-controlled entity one tick at a time: keeps the agent records in sync with
 * the host's entities, refreshes the spatial index, drains pathfinding requests under budget,
 * and runs context building, state evaluation, state actions and movement for the agents
 * whose stagger schedule is due.
 * <p>
 * A tick runs these phases in order:
 * <ol>
 *   <li>reset the per-tick counters</li>
 *   <li>create and destroy agent records to match the agent list</li>
 *   <li>refresh the spatial index, then locate and index the primary target</li>
 *   <li>drain the pathfinding queue</li>
 *   <li>let the strategy prepare for the primary target's position</li>
 *   <li>update eligible agents until the update budget is spent, resuming after the last
 *       agent reached in the previous tick</li>
 *   <li>expire old cached paths when the maintenance interval has elapsed</li>
 *   <li>emit the pathfinding statistics when requests were processed</li>
 * </ol>
 * Every proximity query of a tick therefore sees the positions of phase 3.
 * <p>
 * <b>Thread safety:</b> Not thread-safe. {@link #update} must be called from one thread.
 */
public class AgentOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(AgentOrchestrator.class);

    private static final Set<Class<?>> PRIMARY_TARGET_COMPONENTS = Set.of(Transform.class, Health.class);

    private final SpatialHashGrid grid;
    private final IWorld world;
    private final IEventSink events;
    private final IObstacleMap obstacles;
    private final PathRequestQueue queue = new PathRequestQueue();
    private final BehaviorStateMachine stateMachine = new BehaviorStateMachine();
    private final StatModifierChain modifiers = new StatModifierChain();
    private final ContextBuilder contextBuilder;
    private final StateActions actions;
    private final MovementExecutor movementExecutor;
    private final Int2ObjectLinkedOpenHashMap<Agent> agents = new Int2ObjectLinkedOpenHashMap<>();

    private AiSystemConfig config;
    private PathCache pathCache;
    private FlowFieldCache flowFieldCache;
    private PathfindingService pathfinding;
    private NavMesh navMesh;

    private int primaryTargetId = Agent.NO_TARGET;
    private Vector2 primaryTargetPosition;
    private long lastMaintenanceTime;

    private int agentUpdatesThisTick;
    private int updateCursor;
    private int requestsThisTick;

    private record Tracked(Agent agent, IEntity entity, Transform transform, Movement movement) {}

    /**
     * Creates an orchestrator over an obstacle-free world.
     *
     * @see #AgentOrchestrator(AiSystemConfig, SpatialHashGrid, IWorld, IEventSink, IObstacleMap)
     */
    public AgentOrchestrator(AiSystemConfig config, SpatialHashGrid grid, IWorld world, IEventSink events) {
        this(config, grid, world, events, IObstacleMap.NONE);
    }

    /**
     * Creates an orchestrator.
     *
     * @param config The settings; validated here.
     * @param grid The spatial index, shared with sibling subsystems.
     * @param world Entity lookup.
     * @param events Event output.
     * @param obstacles Walkability for the grid-based strategies.
     * @throws IllegalArgumentException if the configuration is invalid or its strategy cannot be created.
     */
    public AgentOrchestrator(AiSystemConfig config, SpatialHashGrid grid, IWorld world, IEventSink events,
                             IObstacleMap obstacles) {
        config.validate();
        this.config = config;
        this.grid = grid;
        this.world = world;
        this.events = events != null ? events : IEventSink.NONE;
        this.obstacles = obstacles != null ? obstacles : IObstacleMap.NONE;
        this.contextBuilder = new ContextBuilder(grid, world, modifiers);
        this.actions = new StateActions(this::requestPath, this::emit);
        this.movementExecutor = new MovementExecutor(grid, world, modifiers);
        buildPathfinding(config);
    }

    /**
     * Creates an orchestrator from the resolved {@code hivemind} block.
     *
     * @param settings The block holding {@code spatial} and {@code ai}, e.g. from {@link ConfigLoader#load()}.
     * @param world Entity lookup.
     * @param events Event output.
     * @return The orchestrator with a new spatial index.
     */
    public static AgentOrchestrator fromConfig(Config settings, IWorld world, IEventSink events) {
        SpatialHashGrid grid = SpatialHashGrid.fromConfig(settings.getConfig("spatial"));
        AiSystemConfig config = AiSystemConfig.fromConfig(settings.getConfig("ai"));
        return new AgentOrchestrator(config, grid, world, events);
    }

    /**
     * Creates an orchestrator from a configuration file layered over the defaults.
     *
     * @param configFile The HOCON file, or {@code null} to discover one.
     * @param world Entity lookup.
     * @param events Event output.
     * @return The orchestrator with a new spatial index.
     * @throws IllegalArgumentException if the file does not exist or the settings are invalid.
     */
    public static AgentOrchestrator fromConfig(File configFile, IWorld world, IEventSink events) {
        return fromConfig(ConfigLoader.load(configFile), world, events);
    }

    /**
     * Announces the orchestrator through {@link AiEventTypes#AI_SYSTEM_INITIALIZED}.
     */
    public void initialize() {
        String strategyName = pathfinding.getStrategy().getClass().getSimpleName();
        LOG.info("AI orchestrator initialized: algorithm={}, strategy={}, maxAgentUpdatesPerTick={}, maxPathfindsPerTick={}",
                config.algorithm().getConfigName(), strategyName,
                config.maxAgentUpdatesPerTick(), config.maxPathfindsPerTick());
        emit(AiEventTypes.AI_SYSTEM_INITIALIZED, new SystemInitializedEvent(
                config.algorithm(), strategyName, config.maxAgentUpdatesPerTick(), config.maxPathfindsPerTick()));
    }

    /**
     * Advances every agent by one tick.
     *
     * @param tick The tick timing.
     * @param agentEntities The entities the host considers AI-controlled, in update order.
     */
    public void update(TickContext tick, List<IEntity> agentEntities) {
        long now = tick.totalMillis();

        agentUpdatesThisTick = 0;
        requestsThisTick = 0;
        pathfinding.resetTickCounters();

        List<Tracked> tracked = syncAgents(agentEntities, now);

        for (Tracked t : tracked) {
            int id = t.agent().getId();
            if (grid.contains(id)) {
                grid.update(id, t.transform().getPosition());
            } else {
                grid.insert(id, t.transform().getPosition(), t.transform().getRadius());
            }
        }
        refreshPrimaryTarget();

        requestsThisTick = queue.drain(config.maxPathfindsPerTick(), request -> processRequest(request, now));

        if (primaryTargetPosition != null) {
            pathfinding.prepare(primaryTargetPosition);
        }

        updateEligibleAgents(tracked, now);

        if (now - lastMaintenanceTime >= config.maintenanceIntervalMillis()) {
            pathCache.maintain(now);
            lastMaintenanceTime = now;
        }

        if (requestsThisTick > 0) {
            emit(AiEventTypes.AI_PATHFINDING_STATS, new PathfindingStatsEvent(
                    tick.tick(), requestsThisTick, pathfinding.getStrategyInvocations(), pathfinding.getCacheHits(),
                    queue.size(), pathCache.size(), flowFieldCache.size()));
        }
    }

    // ==================== Phases ====================

    private List<Tracked> syncAgents(List<IEntity> agentEntities, long now) {
        List<Tracked> tracked = new ArrayList<>(agentEntities.size());
        IntOpenHashSet seen = new IntOpenHashSet(agentEntities.size());
        for (IEntity entity : agentEntities) {
            Optional<Transform> transform = entity.getComponent(Transform.class);
            Optional<Movement> movement = entity.getComponent(Movement.class);
            Optional<AiComponent> ai = entity.getComponent(AiComponent.class);
            if (transform.isEmpty() || movement.isEmpty() || ai.isEmpty() || !seen.add(entity.getId())) {
                continue;
            }
            Agent agent = agents.get(entity.getId());
            if (agent == null) {
                agent = new Agent(entity.getId(), ai.get(), now);
                agents.put(entity.getId(), agent);
                LOG.debug("Agent {} created ({})", entity.getId(), ai.get().getPersonality().type());
            }
            tracked.add(new Tracked(agent, entity, transform.get(), movement.get()));
        }

        if (agents.size() > seen.size()) {
            List<Integer> gone = new ArrayList<>();
            for (int id : agents.keySet()) {
                if (!seen.contains(id)) {
                    gone.add(id);
                }
            }
            for (int id : gone) {
                destroyAgent(id);
            }
        }
        return tracked;
    }

    /**
     * Updates eligible agents round-robin, starting at the first agent the previous tick's
     * budget did not reach.
     */
    private void updateEligibleAgents(List<Tracked> tracked, long now) {
        int count = tracked.size();
        if (count == 0) {
            return;
        }
        int start = updateCursor % count;
        for (int i = 0; i < count; i++) {
            int index = (start + i) % count;
            if (agentUpdatesThisTick >= config.maxAgentUpdatesPerTick()) {
                updateCursor = index;
                return;
            }
            Tracked t = tracked.get(index);
            Agent agent = t.agent();
            if (agent.isDead() || !agent.isEligible(now)) {
                continue;
            }
            updateAgent(t, now);
            agent.markUpdated(now);
            agentUpdatesThisTick++;
        }
    }

    private void destroyAgent(int id) {
        agents.remove(id);
        queue.discard(id);
        if (id != primaryTargetId) {
            grid.remove(id);
        }
        LOG.debug("Agent {} destroyed", id);
    }

    private void refreshPrimaryTarget() {
        IEntity primary = null;
        for (IEntity candidate : world.getEntitiesWithComponents(PRIMARY_TARGET_COMPONENTS)) {
            if (!candidate.hasComponent(AiComponent.class)
                    && !candidate.getComponent(Health.class).map(Health::isDepleted).orElse(false)) {
                primary = candidate;
                break;
            }
        }

        int previous = primaryTargetId;
        if (primary == null) {
            primaryTargetId = Agent.NO_TARGET;
            primaryTargetPosition = null;
        } else {
            Transform transform = primary.getComponent(Transform.class).orElseThrow();
            primaryTargetId = primary.getId();
            primaryTargetPosition = transform.getPosition();
            if (grid.contains(primaryTargetId)) {
                grid.update(primaryTargetId, primaryTargetPosition);
            } else {
                grid.insert(primaryTargetId, primaryTargetPosition, transform.getRadius());
            }
        }
        if (previous != Agent.NO_TARGET && previous != primaryTargetId && !agents.containsKey(previous)) {
            grid.remove(previous);
        }
    }

    private void processRequest(PathRequest request, long now) {
        Agent agent = agents.get(request.agentId());
        if (agent == null || agent.isDead()) {
            return;
        }
        Optional<Transform> transform = world.getEntity(request.agentId())
                .flatMap(entity -> entity.getComponent(Transform.class));
        if (transform.isEmpty()) {
            return;
        }
        agent.setPath(pathfinding.findPath(transform.get().getPosition(), request.goal(), now));
        agent.setLastPathfindTime(now);
    }

    private void updateAgent(Tracked t, long now) {
        Agent agent = t.agent();
        Vector2 position = t.transform().getPosition();

        AiContext context = contextBuilder.build(agent, t.entity(), position, primaryTargetId, now);

        AgentState previous = agent.getState();
        AgentState next = stateMachine.nextState(previous, context, agent.getProfile());
        if (agent.changeState(next, now)) {
            emit(AiEventTypes.AI_STATE_CHANGED, new StateChangedEvent(agent.getId(), previous, next, now));
            if (next == AgentState.DEAD) {
                onDeath(agent, t.movement());
                return;
            }
        }

        BehaviorNode tree = agent.getProfile().getBehaviorTree();
        if (tree != null) {
            try {
                tree.execute(agent, context);
            } catch (RuntimeException e) {
                LOG.warn("Behavior tree of agent {} failed in state {}: {}", agent.getId(), agent.getState(), e.getMessage());
            }
        }

        actions.execute(agent, context, position, t.movement(), now);
        movementExecutor.apply(agent, position, t.movement(), avoidanceRadiusOf(agent), config.groupBehaviorEnabled());
    }

    private void onDeath(Agent agent, Movement movement) {
        agent.clearPath();
        agent.clearTarget();
        queue.discard(agent.getId());
        movement.stop();
        LOG.debug("Agent {} died", agent.getId());
    }

    private double avoidanceRadiusOf(Agent agent) {
        double radius = agent.getProfile().getAvoidanceRadius();
        return radius < 0.0 ? config.avoidanceRadius() : radius;
    }

    private void requestPath(Agent agent, Vector2 goal, long now) {
        if (!agent.isDead()) {
            queue.enqueue(agent.getId(), goal, now);
        }
    }

    private void emit(String eventType, Object payload) {
        try {
            events.emit(eventType, payload);
        } catch (RuntimeException e) {
            LOG.warn("Event sink '{}' failed for {}: {}", events.getClass().getSimpleName(), eventType, e.getMessage());
        }
    }

    private void buildPathfinding(AiSystemConfig cfg) {
        this.pathCache = new PathCache(cfg.pathQuantum(), cfg.maxCachedPaths(), cfg.pathTtlMillis());
        this.flowFieldCache = new FlowFieldCache(cfg.maxFlowFields());
        PathfindingEnvironment environment =
                new PathfindingEnvironment(grid.getBounds(), obstacles, flowFieldCache, () -> navMesh);
        IPathfindingStrategy strategy = PathfindingStrategyFactory.create(
                cfg.algorithm(), cfg.strategyClass(), environment, cfg.toStrategyOptions());
        this.pathfinding = new PathfindingService(strategy, pathCache, new DirectPathStrategy(cfg.waypointSpacing()));
    }

    // ==================== Host API ====================

    /**
     * Records damage dealt to an agent, feeding its memory and under-attack detection.
     *
     * @param agentId The damaged agent.
     * @param sourceId The attacker.
     * @param amount The damage amount.
     * @param now The current simulation time.
     * @return {@code true} if the agent is tracked.
     */
    public boolean recordDamage(int agentId, int sourceId, double amount, long now) {
        Agent agent = agents.get(agentId);
        if (agent == null) {
            return false;
        }
        agent.recordDamage(sourceId, amount, now);
        return true;
    }

    /**
     * Loads (or replaces) the navigation mesh used by the navmesh strategy. Cached paths are dropped.
     *
     * @param mesh The mesh, or {@code null} to unload.
     */
    public void loadNavigationMesh(NavMesh mesh) {
        this.navMesh = mesh;
        pathCache.clear();
        LOG.info("Navigation mesh {}", mesh == null ? "unloaded" : "loaded with " + mesh.size() + " polygons");
    }

    public void addStatModifier(IStatModifier modifier) {
        modifiers.add(modifier);
    }

    public boolean removeStatModifier(IStatModifier modifier) {
        return modifiers.remove(modifier);
    }

    /**
     * Applies new settings to the running orchestrator. Invalid budgets and sizes are replaced
     * by their defaults instead of being rejected. The strategy and both caches are rebuilt;
     * pending requests and agent records are kept.
     *
     * @param newConfig The new settings.
     * @return The settings actually applied.
     */
    public AiSystemConfig reconfigure(AiSystemConfig newConfig) {
        AiSystemConfig applied = newConfig.clampedForReconfigure();
        buildPathfinding(applied);
        this.config = applied;
        LOG.info("AI orchestrator reconfigured: algorithm={}, maxAgentUpdatesPerTick={}, maxPathfindsPerTick={}",
                applied.algorithm().getConfigName(), applied.maxAgentUpdatesPerTick(), applied.maxPathfindsPerTick());
        return applied;
    }

    public OrchestratorStats getStats() {
        return new OrchestratorStats(
                agentUpdatesThisTick,
                requestsThisTick,
                pathfinding.getStrategyInvocations(),
                pathfinding.getCacheHits(),
                pathCache.size(),
                flowFieldCache.size(),
                queue.size(),
                agents.size(),
                config.algorithm());
    }

    public Optional<Agent> getAgent(int id) {
        return Optional.ofNullable(agents.get(id));
    }

    public Collection<Agent> getAgents() {
        return Collections.unmodifiableCollection(agents.values());
    }

    /**
     * @return The spatial index, for proximity lookups by sibling subsystems.
     */
    public SpatialHashGrid getSpatialIndex() {
        return grid;
    }

    public AiSystemConfig getConfig() {
        return config;
    }

    /** @return The id of the first living non-AI entity with a transform and health, or {@link Agent#NO_TARGET}. */
    public int getPrimaryTargetId() {
        return primaryTargetId;
    }

    public int getPendingRequests() {
        return queue.size();
    }

    public IPathfindingStrategy getStrategy() {
        return pathfinding.getStrategy();
    }
}
