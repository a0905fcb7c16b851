package com.realtime.messenger.policy;

import com.realtime.messenger.common.ErrorKind;
import com.realtime.messenger.common.MessengerException;
import com.realtime.messenger.user.service.UserDirectory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AccessPolicyGuardTest {

    @Mock
    UserDirectory userDirectory;

    @InjectMocks
    AccessPolicyGuard guard;

    private final UUID alice = UUID.randomUUID();
    private final UUID bob = UUID.randomUUID();

    @Test
    void 수신자가_발신자를_차단했으면_BLOCKED() {
        when(userDirectory.hasBlocked(bob, alice)).thenReturn(true);

        assertThat(guard.canSend(alice, bob)).isEqualTo(PolicyDecision.BLOCKED);

        MessengerException e = catchThrowableOfType(() -> guard.requireCanSend(alice, bob), MessengerException.class);
        assertThat(e.getKind()).isEqualTo(ErrorKind.FORBIDDEN);
    }

    @Test
    void 차단은_방향이_있다() {
        // bob 이 alice 를 차단해도 bob -> alice 전송은 막지 않는다
        when(userDirectory.hasBlocked(bob, alice)).thenReturn(true);
        when(userDirectory.hasBlocked(alice, bob)).thenReturn(false);

        assertThat(guard.canSend(alice, bob)).isEqualTo(PolicyDecision.BLOCKED);
        assertThat(guard.canSend(bob, alice)).isEqualTo(PolicyDecision.ALLOWED);
        assertThatCode(() -> guard.requireCanSend(bob, alice)).doesNotThrowAnyException();
    }
}
