package com.ryuqq.lifecycle.application.pipeline;

import com.ryuqq.lifecycle.application.action.DefaultLifecycleActions;
import com.ryuqq.lifecycle.application.collection.MemberCollectionManager;
import com.ryuqq.lifecycle.application.context.LifecycleContext;
import com.ryuqq.lifecycle.application.group.GroupMembershipOrchestrator;
import com.ryuqq.lifecycle.application.group.GroupOrchestrationResult;
import com.ryuqq.lifecycle.application.transition.StatusTransitionPipeline;
import com.ryuqq.lifecycle.core.capability.MemberGroup;
import com.ryuqq.lifecycle.core.capability.MemberKind;
import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.model.EntityKey;
import com.ryuqq.lifecycle.core.model.Transition;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 내장 {@link PipelineOperation} 구현.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
final class PipelineOperations {

    private PipelineOperations() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    private static LocalDateTime effective(LocalDateTime own, LocalDateTime defaultDate) {
        return own != null ? own : defaultDate;
    }

    /**
     * 엔티티 목록에 같은 전이를 순서대로 적용 (고용은 유형별 cascade 포함).
     */
    static final class TransitionBatch implements PipelineOperation {

        private final LifecycleContext context;
        private final Transition transition;
        private final List<RosterEntity> entities;
        private final LocalDateTime date;

        TransitionBatch(LifecycleContext context, Transition transition,
                        Collection<? extends RosterEntity> entities, LocalDateTime date) {
            if (entities == null) {
                throw new IllegalArgumentException("entities cannot be null");
            }
            this.context = context;
            this.transition = transition;
            this.entities = List.copyOf(entities);
            this.date = date;
        }

        @Override
        public String type() {
            return "batch_" + transition.transitionName();
        }

        @Override
        public Object execute(LocalDateTime defaultDate) {
            LocalDateTime resolved = effective(date, defaultDate);
            if (transition == Transition.EMPLOY) {
                new DefaultLifecycleActions(context).employMany(entities, resolved, null);
                return null;
            }
            for (RosterEntity entity : entities) {
                StatusTransitionPipeline.create(context, entity, transition, resolved).execute();
            }
            return null;
        }

        @Override
        public Optional<CompensationRecord> compensate(int index, Object result, LocalDateTime defaultDate) {
            List<EntityKey> keys = entities.stream().map(RosterEntity::key).toList();
            return Optional.of(new CompensationRecord(index, inverse(), keys, effective(date, defaultDate)));
        }

        private String inverse() {
            return switch (transition) {
                case EMPLOY -> CompensationRecord.RELEASE;
                case RELEASE -> CompensationRecord.EMPLOY;
                case RETIRE -> CompensationRecord.UNRETIRE;
                case SUSPEND -> CompensationRecord.REINSTATE;
                case REINSTATE -> CompensationRecord.SUSPEND;
                case INJURE -> throw new IllegalStateException("injury batches are not queued by the pipeline");
            };
        }
    }

    static final class GroupMerge implements PipelineOperation {

        private final LifecycleContext context;
        private final MemberGroup primary;
        private final MemberGroup secondary;
        private final String newName;

        GroupMerge(LifecycleContext context, MemberGroup primary, MemberGroup secondary, String newName) {
            this.context = context;
            this.primary = primary;
            this.secondary = secondary;
            this.newName = newName;
        }

        @Override
        public String type() {
            return "group_merger";
        }

        @Override
        public Object execute(LocalDateTime defaultDate) {
            GroupOrchestrationResult result = GroupMembershipOrchestrator
                .mergeStables(context, primary, secondary, newName)
                .onDate(defaultDate)
                .execute();
            return result.primary().orElse(null);
        }

        @Override
        public Optional<CompensationRecord> compensate(int index, Object result, LocalDateTime defaultDate) {
            return Optional.of(new CompensationRecord(index, CompensationRecord.RESTORE_GROUP_MEMBERSHIPS,
                List.of(primary.key(), secondary.key()), defaultDate));
        }
    }

    static final class GroupSplit implements PipelineOperation {

        private final LifecycleContext context;
        private final MemberGroup original;
        private final String newName;
        private final Map<MemberKind, List<RosterEntity>> members;

        GroupSplit(LifecycleContext context, MemberGroup original, String newName,
                   Map<MemberKind, ? extends Collection<? extends RosterEntity>> members) {
            if (members == null) {
                throw new IllegalArgumentException("members cannot be null");
            }
            this.context = context;
            this.original = original;
            this.newName = newName;
            Map<MemberKind, List<RosterEntity>> copy = new LinkedHashMap<>();
            members.forEach((kind, entities) -> copy.put(kind, List.copyOf(entities)));
            this.members = copy;
        }

        @Override
        public String type() {
            return "group_split";
        }

        @Override
        public Object execute(LocalDateTime defaultDate) {
            GroupMembershipOrchestrator orchestrator = GroupMembershipOrchestrator.splitStable(context, original, newName);
            members.forEach((kind, entities) -> {
                switch (kind) {
                    case WRESTLERS -> orchestrator.transferWrestlers(entities);
                    case TAG_TEAMS -> orchestrator.transferTagTeams(entities);
                    case MANAGERS -> orchestrator.transferManagers(entities);
                }
            });
            return orchestrator.onDate(defaultDate).execute().primary().orElse(null);
        }

        @Override
        public Optional<CompensationRecord> compensate(int index, Object result, LocalDateTime defaultDate) {
            if (result instanceof MemberGroup created) {
                return Optional.of(new CompensationRecord(index, CompensationRecord.DELETE_GROUP,
                    List.of(created.key()), defaultDate));
            }
            return Optional.empty();
        }
    }

    static final class FilterAndBatch implements PipelineOperation {

        private final LifecycleContext context;
        private final List<RosterEntity> collection;
        private final Map<String, Object> criteria;
        private final String operation;
        private final LocalDateTime date;

        FilterAndBatch(LifecycleContext context, Collection<? extends RosterEntity> collection,
                       Map<String, ?> criteria, String operation, LocalDateTime date) {
            if (collection == null) {
                throw new IllegalArgumentException("collection cannot be null");
            }
            if (criteria == null) {
                throw new IllegalArgumentException("criteria cannot be null");
            }
            if (operation == null) {
                throw new IllegalArgumentException("operation cannot be null");
            }
            this.context = context;
            this.collection = List.copyOf(collection);
            this.criteria = new LinkedHashMap<>(criteria);
            this.operation = operation;
            this.date = date;
        }

        @Override
        public String type() {
            return "filter_and_batch";
        }

        @Override
        public Object execute(LocalDateTime defaultDate) {
            // 배치로 상태가 바뀌어도 통계 대상은 필터 시점의 멤버로 고정
            List<RosterEntity> matched = MemberCollectionManager.from(context, collection)
                .filterByCriteria(criteria)
                .get();
            MemberCollectionManager manager = MemberCollectionManager.from(context, matched);
            manager.batch(operation, effective(date, defaultDate), null);
            return manager.getStatistics();
        }

        @Override
        public Optional<CompensationRecord> compensate(int index, Object result, LocalDateTime defaultDate) {
            return Optional.empty();
        }
    }

    static final class GroupOrchestration implements PipelineOperation {

        private final LifecycleContext context;
        private final Function<LifecycleContext, ?> callback;

        GroupOrchestration(LifecycleContext context, Function<LifecycleContext, ?> callback) {
            if (callback == null) {
                throw new IllegalArgumentException("callback cannot be null");
            }
            this.context = context;
            this.callback = callback;
        }

        @Override
        public String type() {
            return "group_orchestration";
        }

        @Override
        public Object execute(LocalDateTime defaultDate) {
            return callback.apply(context);
        }

        @Override
        public Optional<CompensationRecord> compensate(int index, Object result, LocalDateTime defaultDate) {
            return Optional.empty();
        }
    }

    static final class Custom implements PipelineOperation {

        private final Supplier<?> action;
        private final Consumer<Object> rollback;

        Custom(Supplier<?> action, Consumer<Object> rollback) {
            if (action == null) {
                throw new IllegalArgumentException("action cannot be null");
            }
            this.action = action;
            this.rollback = rollback;
        }

        @Override
        public String type() {
            return "custom";
        }

        @Override
        public Object execute(LocalDateTime defaultDate) {
            return action.get();
        }

        @Override
        public Optional<CompensationRecord> compensate(int index, Object result, LocalDateTime defaultDate) {
            if (rollback != null) {
                rollback.accept(result);
            }
            return Optional.empty();
        }
    }
}
