package com.example.clubadmin.service.accounts;

import com.example.clubadmin.domain.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Records outbound mail in the log instead of delivering it.
 */
@Slf4j
@Component
public class LoggingMemberNotifier implements MemberNotifier {

    @Async
    @Override
    public void applicationApproved(User user) {
        log.info("Queued 'application approved' e-mail for user {} <{}>", user.getId(), user.getEmail());
    }

    @Async
    @Override
    public void applicationRejected(User user) {
        log.info("Queued 'application rejected' e-mail for user {} <{}>", user.getId(), user.getEmail());
    }
}
