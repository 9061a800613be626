package org.operaton.fitjourney.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.fitjourney.model.entity.ChangeQueueEntry.SyncOperation;
import org.operaton.fitjourney.model.entity.Milestone;
import org.operaton.fitjourney.model.entity.Milestone.MilestoneKind;
import org.operaton.fitjourney.repository.MilestoneRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Append-only record of personal bests, streak milestones and achieved goals.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MilestoneService {

    private final MilestoneRepository milestoneRepository;
    private final ChangeQueueService changeQueueService;
    private final Clock clock;

    @Transactional
    public Milestone recordMilestone(String userId, MilestoneKind kind, Long exerciseId, Double value) {
        Milestone milestone = Milestone.builder()
                .userId(userId)
                .kind(kind)
                .exerciseId(exerciseId)
                .value(value)
                .date(LocalDate.now(clock))
                .build();

        Milestone saved = milestoneRepository.save(milestone);
        changeQueueService.enqueue(ChangeQueueService.TABLE_MILESTONE, saved.getId(), SyncOperation.INSERT);
        log.info("Milestone {} for user {}: exercise={}, value={}", kind, userId, exerciseId, value);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Milestone> getMilestones(String userId) {
        return milestoneRepository.findByUserIdOrderByDateDescIdDesc(userId);
    }

    @Transactional(readOnly = true)
    public List<Milestone> getMilestonesByKind(String userId, MilestoneKind kind) {
        return milestoneRepository.findByUserIdAndKindOrderByDateDescIdDesc(userId, kind);
    }
}
