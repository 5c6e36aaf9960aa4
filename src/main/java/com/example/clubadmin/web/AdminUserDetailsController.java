package com.example.clubadmin.web;

import com.example.clubadmin.domain.BoardPosition;
import com.example.clubadmin.domain.MembershipType;
import com.example.clubadmin.domain.User;
import com.example.clubadmin.domain.UserRole;
import com.example.clubadmin.domain.UserState;
import com.example.clubadmin.security.CurrentUserService;
import com.example.clubadmin.service.NotFoundException;
import com.example.clubadmin.service.accounts.MembershipService;
import com.example.clubadmin.service.accounts.UserAdminService;
import com.example.clubadmin.service.expenses.BankAccountDetails;
import com.example.clubadmin.service.expenses.BankAccountService;
import com.example.clubadmin.service.ledger.LedgerService;
import com.example.clubadmin.web.form.UserForm;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.BindingResult;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;

import java.util.List;

/**
 * Per-user admin tabs: profile, membership, payments and (treasurer only) bank accounts.
 */
@Slf4j
@Controller
@RequestMapping("/admin/users/{id}/details")
@RequiredArgsConstructor
public class AdminUserDetailsController {

    private static final List<String> TABS = List.of("profile", "membership", "payments", "bank-accounts");
    private static final int PAYMENTS_PER_PAGE = 20;

    private final UserAdminService userAdminService;
    private final MembershipService membershipService;
    private final LedgerService ledgerService;
    private final BankAccountService bankAccountService;
    private final CurrentUserService currentUserService;

    @GetMapping
    public String details(@PathVariable Long id,
                          @RequestParam(defaultValue = "profile") String tab,
                          @RequestParam(defaultValue = "1") int page,
                          Model model) {
        User user = userAdminService.get(id);
        if (!model.containsAttribute("userForm")) {
            model.addAttribute("userForm", UserForm.from(user));
        }
        populate(model, user, TABS.contains(tab) ? tab : "profile", page);
        return "admin/users/details";
    }

    @PostMapping
    public String update(@PathVariable Long id,
                         @Valid @ModelAttribute("userForm") UserForm form,
                         BindingResult binding,
                         Model model,
                         RedirectAttributes redirectAttributes) {
        User user = userAdminService.get(id);
        if (form.getAddressLine1() != null && !form.getAddressLine1().isBlank()
                && (form.getCity() == null || form.getCity().isBlank())) {
            binding.rejectValue("city", "required", "can't be blank");
        }
        if (binding.hasErrors()) {
            populate(model, user, "profile", 1);
            return "admin/users/details";
        }
        try {
            userAdminService.update(id, form.toUpdate(), currentUserService.currentUser());
            redirectAttributes.addFlashAttribute("successMessage", "User updated");
            return "redirect:/admin/users/" + id + "/details";
        } catch (IllegalArgumentException e) {
            binding.rejectValue("email", "taken", e.getMessage());
        } catch (Exception e) {
            log.error("Saving user {} failed", id, e);
            binding.reject("save", "Failed to save");
        }
        model.addAttribute("errorMessage", "Failed to save");
        populate(model, user, "profile", 1);
        return "admin/users/details";
    }

    /* ───────── membership ───────── */

    @PostMapping("/membership-type")
    public String changeMembershipType(@PathVariable Long id,
                                       @RequestParam(required = false) String membershipType,
                                       RedirectAttributes redirectAttributes) {
        try {
            String message = membershipService.changeMembershipType(id, membershipType);
            redirectAttributes.addFlashAttribute("successMessage", message);
        } catch (IllegalArgumentException | IllegalStateException e) {
            redirectAttributes.addFlashAttribute("errorMessage", e.getMessage());
        }
        return membershipTab(id);
    }

    @PostMapping("/membership-period")
    public String updateMembershipPeriod(@PathVariable Long id,
                                         @RequestParam(required = false) String periodEnd,
                                         RedirectAttributes redirectAttributes) {
        try {
            membershipService.updateMembershipPeriod(id, periodEnd);
            redirectAttributes.addFlashAttribute("successMessage", "Membership period updated");
        } catch (IllegalArgumentException | IllegalStateException e) {
            redirectAttributes.addFlashAttribute("errorMessage", e.getMessage());
        }
        return membershipTab(id);
    }

    @PostMapping("/lifetime")
    public String updateLifetime(@PathVariable Long id,
                                 @RequestParam(defaultValue = "false") boolean award,
                                 @RequestParam(required = false) String awardedAt,
                                 RedirectAttributes redirectAttributes) {
        try {
            String message = membershipService.updateLifetimeMembership(id, award, awardedAt);
            redirectAttributes.addFlashAttribute("successMessage", message);
        } catch (Exception e) {
            log.error("Updating lifetime membership of user {} failed", id, e);
            redirectAttributes.addFlashAttribute("errorMessage", "Failed to update lifetime membership");
        }
        return membershipTab(id);
    }

    private static String membershipTab(Long id) {
        return "redirect:/admin/users/" + id + "/details?tab=membership";
    }

    /* ───────── bank accounts ───────── */

    /** Renders the tab with one account decrypted; never redirected so the numbers stay out of the session. */
    @PostMapping("/bank-accounts/{accountId}/unseal")
    public String unseal(@PathVariable Long id, @PathVariable Long accountId, Model model) {
        User user = userAdminService.get(id);
        model.addAttribute("userForm", UserForm.from(user));
        try {
            BankAccountDetails details = bankAccountService.unseal(accountId, currentUserService.currentUser());
            if (!details.userId().equals(id)) {
                model.addAttribute("errorMessage", BankAccountService.NOT_FOUND);
            } else {
                model.addAttribute("unsealed", details);
            }
        } catch (AccessDeniedException e) {
            model.addAttribute("errorMessage", BankAccountService.UNAUTHORIZED);
        } catch (NotFoundException e) {
            model.addAttribute("errorMessage", BankAccountService.NOT_FOUND);
        }
        populate(model, user, "bank-accounts", 1);
        return "admin/users/details";
    }

    private void populate(Model model, User user, String tab, int page) {
        User viewer = currentUserService.currentUser();
        model.addAttribute("user", user);
        model.addAttribute("tab", tab);
        model.addAttribute("allRoles", UserRole.values());
        model.addAttribute("allStates", UserState.values());
        model.addAttribute("allBoardPositions", BoardPosition.values());
        model.addAttribute("plans", List.of(MembershipType.SINGLE, MembershipType.FAMILY));
        model.addAttribute("membership", membershipService.effectiveType(user));
        model.addAttribute("subscription", membershipService.activeSubscription(user.getId()).orElse(null));
        model.addAttribute("canViewBankAccounts", viewer.isTreasurer());
        switch (tab) {
            case "payments" -> model.addAttribute("payments",
                    ledgerService.userPayments(user.getId(), page, PAYMENTS_PER_PAGE));
            case "bank-accounts" -> {
                if (viewer.isTreasurer()) {
                    model.addAttribute("bankAccounts", bankAccountService.list(user.getId()));
                } else if (!model.containsAttribute("errorMessage")) {
                    model.addAttribute("errorMessage", BankAccountService.UNAUTHORIZED);
                }
            }
            default -> {
            }
        }
    }
}
