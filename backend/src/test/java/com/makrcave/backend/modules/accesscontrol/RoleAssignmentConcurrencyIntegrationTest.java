package com.makrcave.backend.modules.accesscontrol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.makrcave.backend.global.error.ProblemException;
import com.makrcave.backend.modules.accesscontrol.application.RoleAssignmentService;
import com.makrcave.backend.modules.accesscontrol.application.RoleAssignmentService.AssignRoleCommand;
import com.makrcave.backend.modules.accesscontrol.domain.Role;
import com.makrcave.backend.modules.accesscontrol.infrastructure.persistence.RoleAssignmentLogRepository;
import com.makrcave.backend.modules.accesscontrol.infrastructure.persistence.RoleRepository;
import com.makrcave.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.makrcave.backend.modules.member.domain.Member;
import com.makrcave.backend.modules.member.infrastructure.persistence.MemberRepository;
import com.makrcave.backend.support.AbstractPostgresIntegrationTest;
import com.makrcave.backend.support.TestAccessTokens;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Races real transactions against PostgreSQL; the member and role row locks decide the winners.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class RoleAssignmentConcurrencyIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final UUID MAKERSPACE_ID = UUID.fromString("6f1c2b1e-0000-4000-8000-00000000e001");
    private static final int CONTENDERS = 6;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private MemberRepository memberRepository;

    @Autowired
    private RoleRepository roleRepository;

    @Autowired
    private RoleAssignmentLogRepository roleAssignmentLogRepository;

    @Autowired
    private RoleAssignmentService roleAssignmentService;

    @Autowired
    private JwtTokenProvider jwtTokenProvider;

    @Autowired
    private Clock clock;

    private ExecutorService executor;
    private Member root;
    private String superAdminToken;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(CONTENDERS);
        root = memberRepository.save(new Member("root@makrcave.test", "Root", "Admin", null));
        superAdminToken = new TestAccessTokens(jwtTokenProvider, clock).issue(root.getId(), "super_admin", null, List.of());
    }

    @AfterEach
    void stopExecutor() throws InterruptedException {
        executor.shutdownNow();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void concurrentAssignmentsOfTheSamePairGrantTheRoleOnce() throws Exception {
        Role role = createRole("Kiln Operator", null);
        Member maker = memberRepository.save(new Member("kiln@makrcave.test", "Kim", "Kiln", MAKERSPACE_ID));

        List<Callable<Object>> attempts = new ArrayList<>();
        for (int i = 0; i < 2; i++) {
            attempts.add(() -> roleAssignmentService.assign(command(maker, role)));
        }
        Outcome outcome = race(attempts);

        assertThat(outcome.successes()).isEqualTo(1);
        assertThat(outcome.failures()).containsExactly("access.role_already_assigned");
        assertThat(roleRepository.countHolders(role.getId())).isEqualTo(1);
        assertThat(ledgerEntries(role)).isEqualTo(1);
    }

    @Test
    void concurrentAssignmentsNeverOverrunTheRoleCap() throws Exception {
        Role role = createRole("Laser Cutter Lead", 2);
        List<Callable<Object>> attempts = new ArrayList<>();
        for (int i = 0; i < CONTENDERS; i++) {
            Member candidate = memberRepository.save(
                    new Member("lead" + i + "@makrcave.test", "Lee", "Lead " + i, MAKERSPACE_ID));
            attempts.add(() -> roleAssignmentService.assign(command(candidate, role)));
        }
        Outcome outcome = race(attempts);

        assertThat(outcome.successes()).isEqualTo(2);
        assertThat(outcome.failures()).hasSize(CONTENDERS - 2).containsOnly("access.role_not_assignable");
        assertThat(roleRepository.countHolders(role.getId())).isEqualTo(2);
        assertThat(ledgerEntries(role)).isEqualTo(2);
    }

    private Outcome race(List<Callable<Object>> attempts) throws InterruptedException {
        CountDownLatch ready = new CountDownLatch(attempts.size());
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Object>> futures = new ArrayList<>();
        for (Callable<Object> attempt : attempts) {
            futures.add(executor.submit(() -> {
                ready.countDown();
                start.await();
                return attempt.call();
            }));
        }
        assertThat(ready.await(10, TimeUnit.SECONDS)).isTrue();
        start.countDown();

        int successes = 0;
        List<String> failures = new ArrayList<>();
        for (Future<Object> future : futures) {
            try {
                future.get(30, TimeUnit.SECONDS);
                successes++;
            } catch (ExecutionException ex) {
                failures.add(ex.getCause() instanceof ProblemException problem
                        ? problem.getCode()
                        : ex.getCause().getClass().getName());
            } catch (TimeoutException ex) {
                throw new IllegalStateException("Assignment did not finish within 30 seconds", ex);
            }
        }
        return new Outcome(successes, failures);
    }

    private Role createRole(String name, Integer maxAssignments) throws Exception {
        mockMvc.perform(post("/access-control/roles")
                        .header("Authorization", "Bearer " + superAdminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"%s","makerspaceId":"%s","maxAssignments":%s}
                                """.formatted(name, MAKERSPACE_ID, maxAssignments == null ? "null" : maxAssignments)))
                .andExpect(status().isCreated());
        return roleRepository.findByNameIgnoreCaseAndMakerspaceId(name, MAKERSPACE_ID).orElseThrow();
    }

    private AssignRoleCommand command(Member member, Role role) {
        return new AssignRoleCommand(member.getId(), role.getId(), root.getId(), true, null, null, null);
    }

    private long ledgerEntries(Role role) {
        return roleAssignmentLogRepository.findByRoleIdOrderByCreatedAtDesc(role.getId(), PageRequest.of(0, 50))
                .getTotalElements();
    }

    private record Outcome(int successes, List<String> failures) {
    }
}
