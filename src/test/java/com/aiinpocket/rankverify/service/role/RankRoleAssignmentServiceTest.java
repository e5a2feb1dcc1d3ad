package com.aiinpocket.rankverify.service.role;

import com.aiinpocket.rankverify.exception.RoleConfigException;
import com.aiinpocket.rankverify.exception.RolePermissionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.aiinpocket.rankverify.TestFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RankRoleAssignmentService 段位身分組切換")
class RankRoleAssignmentServiceTest {

    private static final String MEMBER = "user-1";
    private static final String NON_RANK_ROLE = "r-moderator";

    private FakeRoleGateway gateway;
    private RankRoleAssignmentService service;

    @BeforeEach
    void setUp() {
        gateway = new FakeRoleGateway().withGuildRoles(
                ROOKIE.token(), APPRENTICE.token(), VETERAN.token(), PROFESSIONAL.token(),
                MASTER.token(), GRANDMASTER.token(), GALACTIC_OVERLORD.token(), NON_RANK_ROLE);
        service = new RankRoleAssignmentService(gateway, staticProvider(RANKS));
    }

    @Test
    @DisplayName("從 Rookie 升到 Veteran：移除舊段位，只留下新段位")
    void promote() {
        // Given
        gateway.withMember(MEMBER, ROOKIE.token());

        // When
        boolean granted = service.assign(MEMBER, VETERAN);

        // Then
        assertThat(granted).isTrue();
        assertThat(gateway.rolesOf(MEMBER)).containsExactly(VETERAN.token());
    }

    @Test
    @DisplayName("原本沒有段位身分組時直接新增")
    void noRankRoleHeld() {
        boolean granted = service.assign(MEMBER, APPRENTICE);

        assertThat(granted).isTrue();
        assertThat(gateway.rolesOf(MEMBER)).containsExactly(APPRENTICE.token());
    }

    @Test
    @DisplayName("同時持有多個段位身分組時清到只剩目標")
    void multipleRankRolesHeld() {
        gateway.withMember(MEMBER, ROOKIE.token(), MASTER.token(), VETERAN.token());

        boolean granted = service.assign(MEMBER, VETERAN);

        assertThat(granted).isFalse();
        assertThat(gateway.rolesOf(MEMBER)).containsExactly(VETERAN.token());
        assertThat(gateway.calls).doesNotContain("add:" + VETERAN.token());
    }

    @Test
    @DisplayName("非段位身分組不受影響")
    void nonRankRolesKept() {
        gateway.withMember(MEMBER, NON_RANK_ROLE, ROOKIE.token());

        service.assign(MEMBER, GALACTIC_OVERLORD);

        assertThat(gateway.rolesOf(MEMBER)).containsExactlyInAnyOrder(NON_RANK_ROLE, GALACTIC_OVERLORD.token());
    }

    @Test
    @DisplayName("目標身分組不存在時拋出 RoleConfigException，成員沒有任何段位身分組")
    void missingTargetRole() {
        gateway.guildRoles.remove(VETERAN.token());
        gateway.withMember(MEMBER, ROOKIE.token(), NON_RANK_ROLE);

        assertThatThrownBy(() -> service.assign(MEMBER, VETERAN)).isInstanceOf(RoleConfigException.class);
        assertThat(gateway.rolesOf(MEMBER)).containsExactly(NON_RANK_ROLE);
    }

    @Test
    @DisplayName("權限不足時向外拋出 RolePermissionException")
    void permissionDenied() {
        gateway.withMember(MEMBER, ROOKIE.token());
        gateway.forbidden = true;

        assertThatThrownBy(() -> service.assign(MEMBER, VETERAN)).isInstanceOf(RolePermissionException.class);
    }

    @Test
    @DisplayName("removeAll 只移除段位身分組")
    void removeAll() {
        gateway.withMember(MEMBER, NON_RANK_ROLE, ROOKIE.token(), MASTER.token());

        assertThat(service.removeAll(MEMBER)).isEqualTo(2);
        assertThat(gateway.rolesOf(MEMBER)).containsExactly(NON_RANK_ROLE);
    }

    @Test
    @DisplayName("remove 在成員沒有該身分組時不呼叫 API")
    void removeMissing() {
        gateway.withMember(MEMBER, ROOKIE.token());

        service.remove(MEMBER, VETERAN.token());
        service.remove(MEMBER, ROOKIE.token());

        assertThat(gateway.calls).containsExactly("list:" + MEMBER, "list:" + MEMBER, "remove:" + ROOKIE.token());
    }
}
