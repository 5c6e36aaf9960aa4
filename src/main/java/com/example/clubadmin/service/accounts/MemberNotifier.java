package com.example.clubadmin.service.accounts;

import com.example.clubadmin.domain.User;

/**
 * Outbound member e-mail.
 */
public interface MemberNotifier {

    void applicationApproved(User user);

    void applicationRejected(User user);
}
