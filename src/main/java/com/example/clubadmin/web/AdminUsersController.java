package com.example.clubadmin.web;

import com.example.clubadmin.domain.BoardPosition;
import com.example.clubadmin.domain.MembershipType;
import com.example.clubadmin.domain.User;
import com.example.clubadmin.domain.UserRole;
import com.example.clubadmin.domain.UserState;
import com.example.clubadmin.security.CurrentUserService;
import com.example.clubadmin.service.accounts.UserAdminService;
import com.example.clubadmin.service.accounts.UserRow;
import com.example.clubadmin.service.accounts.UserSearchCriteria;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;

import java.util.List;
import java.util.Set;

/**
 * Member directory: search/filter list, application review.
 */
@Slf4j
@Controller
@RequestMapping("/admin/users")
@RequiredArgsConstructor
public class AdminUsersController {

    private final UserAdminService userAdminService;
    private final CurrentUserService currentUserService;

    @GetMapping
    public String list(@RequestParam(required = false) String search,
                       @RequestParam(name = "state", required = false) Set<UserState> states,
                       @RequestParam(name = "role", required = false) Set<UserRole> roles,
                       @RequestParam(name = "boardPosition", required = false) Set<BoardPosition> boardPositions,
                       @RequestParam(name = "membership", required = false) Set<MembershipType> memberships,
                       @RequestParam(defaultValue = "1") int page,
                       @RequestParam(defaultValue = "" + UserAdminService.DEFAULT_PAGE_SIZE) int size,
                       @RequestParam(defaultValue = "email") String sort,
                       @RequestParam(defaultValue = "asc") String dir,
                       Model model) {
        UserSearchCriteria criteria = UserSearchCriteria.builder()
                .query(search)
                .states(states)
                .roles(roles)
                .boardPositions(boardPositions)
                .membershipTypes(memberships)
                .build();
        Page<UserRow> rows = userAdminService.list(criteria, page, size, sort, dir);
        model.addAttribute("rows", rows);
        model.addAttribute("criteria", criteria);
        model.addAttribute("search", search);
        model.addAttribute("sort", sort);
        model.addAttribute("dir", dir);
        model.addAttribute("allStates", UserState.values());
        model.addAttribute("allRoles", UserRole.values());
        model.addAttribute("allBoardPositions", BoardPosition.values());
        model.addAttribute("allMemberships", List.of(MembershipType.values()));
        return "admin/users/list";
    }

    @GetMapping("/{id}")
    public String show(@PathVariable Long id, Model model) {
        User user = userAdminService.get(id);
        model.addAttribute("user", user);
        model.addAttribute("application", userAdminService.application(id).orElse(null));
        model.addAttribute("events", userAdminService.events(id));
        return "admin/users/show";
    }

    @PostMapping("/{id}/approve")
    public String approve(@PathVariable Long id, RedirectAttributes redirectAttributes) {
        try {
            userAdminService.approve(id, currentUserService.currentUser());
            redirectAttributes.addFlashAttribute("successMessage", "User was approved and is now a member!");
        } catch (Exception e) {
            log.error("Approving user {} failed", id, e);
            redirectAttributes.addFlashAttribute("errorMessage", "Something went wrong");
        }
        return "redirect:/admin/users/" + id;
    }

    @PostMapping("/{id}/reject")
    public String reject(@PathVariable Long id, RedirectAttributes redirectAttributes) {
        try {
            userAdminService.reject(id, currentUserService.currentUser());
            redirectAttributes.addFlashAttribute("successMessage", "User application was rejected!");
        } catch (Exception e) {
            log.error("Rejecting user {} failed", id, e);
            redirectAttributes.addFlashAttribute("errorMessage", "Something went wrong");
        }
        return "redirect:/admin/users/" + id;
    }
}
