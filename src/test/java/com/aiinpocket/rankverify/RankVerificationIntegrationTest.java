package com.aiinpocket.rankverify;

import com.aiinpocket.rankverify.model.dto.ImageSource;
import com.aiinpocket.rankverify.model.dto.VerificationOutcome;
import com.aiinpocket.rankverify.model.enums.FailureReason;
import com.aiinpocket.rankverify.model.enums.LockConflictReason;
import com.aiinpocket.rankverify.model.enums.VerificationStatus;
import com.aiinpocket.rankverify.repository.LinkedAccountRepository;
import com.aiinpocket.rankverify.repository.ScreenshotLockRepository;
import com.aiinpocket.rankverify.repository.VerificationEventRepository;
import com.aiinpocket.rankverify.service.RankVerificationService;
import com.aiinpocket.rankverify.service.role.RoleManagementGateway;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * 完整管線：本機 HTTP 伺服器提供截圖、mock 模式的影像辨識、H2 資料庫，只替換身分組 API。
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("截圖驗證完整流程")
class RankVerificationIntegrationTest {

    private static final String GALACTIC_OVERLORD_TOKEN = "1180000000000000008";

    @Autowired
    private RankVerificationService verificationService;

    @Autowired
    private ScreenshotLockRepository lockRepository;

    @Autowired
    private LinkedAccountRepository accountRepository;

    @Autowired
    private VerificationEventRepository eventRepository;

    @MockitoBean
    private RoleManagementGateway gateway;

    private HttpServer server;
    private final Set<String> memberRoles = new HashSet<>();

    @BeforeEach
    void setUp() throws IOException {
        lockRepository.deleteAll();
        accountRepository.deleteAll();

        byte[] png = {(byte) 0x89, 'P', 'N', 'G', 13, 10, 26, 10, 1, 2, 3, 4};
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/attachments/profile.png", exchange -> {
            exchange.sendResponseHeaders(200, png.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(png);
            }
        });
        server.start();

        when(gateway.listRoles(anyString())).thenAnswer(inv -> new HashSet<>(memberRoles));
        when(gateway.roleExists(anyString())).thenReturn(true);
        doAnswer(inv -> memberRoles.add(inv.getArgument(1)))
                .when(gateway).addRole(anyString(), anyString(), anyString());
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private ImageSource screenshot() {
        return ImageSource.of("http://127.0.0.1:" + server.getAddress().getPort() + "/attachments/profile.png");
    }

    @Test
    @DisplayName("驗證成功後寫入截圖鎖、綁定帳號與稽核事件；他人再提交同一張截圖被拒")
    void endToEnd() {
        // When
        VerificationOutcome first = verificationService.processAndVerify(screenshot(), "alice");

        // Then
        assertThat(first.status()).isEqualTo(VerificationStatus.SUCCESS);
        assertThat(first.rank()).isEqualTo("Galactic Overlord");
        assertThat(first.level()).isEqualTo(618);
        assertThat(memberRoles).containsExactly(GALACTIC_OVERLORD_TOKEN);
        assertThat(lockRepository.findByUniqueId("182-625-474-6")).isPresent();
        assertThat(accountRepository.findByOwnerIdentityAndUniqueId("alice", "182-625-474-6"))
                .hasValueSatisfying(a -> assertThat(a.isPrimaryAccount()).isTrue());
        assertThat(eventRepository.countByOwnerIdentityAndStatus("alice", VerificationStatus.SUCCESS))
                .isPositive();

        // When: 本人重複提交
        VerificationOutcome again = verificationService.processAndVerify(screenshot(), "alice");

        // Then
        assertThat(again.status()).isEqualTo(VerificationStatus.SUCCESS);
        assertThat(lockRepository.count()).isEqualTo(1);

        // When: 他人提交同一張截圖
        VerificationOutcome stolen = verificationService.processAndVerify(screenshot(), "mallory");

        // Then
        assertThat(stolen.failureReason()).isEqualTo(FailureReason.ALREADY_CLAIMED);
        assertThat(stolen.conflictReason()).isEqualTo(LockConflictReason.HASH_CONFLICT);
        verify(gateway, never()).addRole(eq("mallory"), anyString(), anyString());
    }
}
