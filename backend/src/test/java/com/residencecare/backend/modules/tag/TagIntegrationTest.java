package com.residencecare.backend.modules.tag;

import static com.residencecare.backend.support.StructureFixtures.ACTOR_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.residencecare.backend.modules.lifecycle.domain.EntityLifecycleException;
import com.residencecare.backend.modules.lifecycle.domain.EntityLifecycleFailure;
import com.residencecare.backend.modules.resident.domain.Resident;
import com.residencecare.backend.modules.tag.application.TagService;
import com.residencecare.backend.modules.tag.domain.ResidentTag;
import com.residencecare.backend.modules.tag.domain.Tag;
import com.residencecare.backend.support.AbstractPostgresIntegrationTest;
import com.residencecare.backend.support.StructureFixtures;
import com.residencecare.backend.support.StructureFixtures.Site;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class TagIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private TagService tagService;

    @Autowired
    private StructureFixtures fixtures;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Test
    @DisplayName("assignment is idempotent and unassignment hard-deletes the association row")
    void assignAndUnassign() {
        Site site = fixtures.site("Residence North");
        Resident resident = fixtures.resident(site, "Ana Ruiz", null);
        Tag tag = tagService.createTag("diabetic", ACTOR_ID);

        ResidentTag first = tagService.assign(resident.getId(), tag.getId(), ACTOR_ID);
        ResidentTag again = tagService.assign(resident.getId(), tag.getId(), UUID.randomUUID());

        assertThat(again.getAssignedBy()).isEqualTo(ACTOR_ID);
        assertThat(again.getAssignedAt()).isEqualTo(first.getAssignedAt());

        assertThat(tagService.tagIdsOf(resident.getId())).containsExactly(tag.getId());

        assertThat(tagService.unassign(resident.getId(), tag.getId())).isTrue();
        assertThat(tagService.unassign(resident.getId(), tag.getId())).isFalse();
        assertThat(countRows("resident_tag")).isZero();
        assertThat(countRows("resident_history")).isEqualTo(1);
    }

    @Test
    @DisplayName("tag names are globally unique and unknown tags cannot be assigned")
    void tagConstraints() {
        Site site = fixtures.site("Residence North");
        Resident resident = fixtures.resident(site, "Ana Ruiz", null);
        tagService.createTag("fall-risk", ACTOR_ID);

        assertThatThrownBy(() -> tagService.createTag("fall-risk", ACTOR_ID))
                .isInstanceOfSatisfying(EntityLifecycleException.class, ex ->
                        assertThat(ex.getFailure()).isEqualTo(EntityLifecycleFailure.DUPLICATE_VALUE));
        assertThatThrownBy(() -> tagService.assign(resident.getId(), UUID.randomUUID(), ACTOR_ID))
                .isInstanceOfSatisfying(EntityLifecycleException.class, ex ->
                        assertThat(ex.getFailure()).isEqualTo(EntityLifecycleFailure.REFERENCE_NOT_FOUND));
    }

    @Test
    @DisplayName("concurrent assignments of the same tag all succeed and leave one row")
    void concurrentAssignments() throws Exception {
        Site site = fixtures.site("Residence North");
        Resident resident = fixtures.resident(site, "Ana Ruiz", null);
        Tag tag = tagService.createTag("night-watch", ACTOR_ID);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<ResidentTag> assigned = new ArrayList<>();
        try {
            List<Future<ResidentTag>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                Callable<ResidentTag> assignment = () -> {
                    start.await();
                    return tagService.assign(resident.getId(), tag.getId(), UUID.randomUUID());
                };
                futures.add(executor.submit(assignment));
            }
            start.countDown();
            for (Future<ResidentTag> future : futures) {
                assigned.add(future.get(30, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(countRows("resident_tag")).isEqualTo(1);
        assertThat(assigned).extracting(ResidentTag::getAssignedBy).containsOnly(assigned.get(0).getAssignedBy());
    }

    private long countRows(String table) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return count != null ? count : 0L;
    }
}
