package com.example.clubadmin.service.posts;

import com.example.clubadmin.config.CacheConfig;
import com.example.clubadmin.domain.Post;
import com.example.clubadmin.domain.PostState;
import com.example.clubadmin.domain.User;
import com.example.clubadmin.repository.PostRepository;
import com.example.clubadmin.service.NotFoundException;
import com.example.clubadmin.util.HtmlSanitizer;
import com.example.clubadmin.util.Slugs;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.*;

@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class PostService {

    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_TITLE = 255;
    public static final int MAX_URL_NAME = 255;
    public static final int MAX_PREVIEW = 500;
    public static final Set<String> SORTABLE = Set.of("title", "state", "publishedOn", "updatedAt");

    private final PostRepository postRepository;

    /* ───────── listing ───────── */

    @Transactional(readOnly = true)
    public Page<Post> list(PostSearchCriteria criteria, int page, int size, String sort, String direction) {
        String property = sort != null && SORTABLE.contains(sort) ? sort : "updatedAt";
        Sort.Direction dir = "asc".equalsIgnoreCase(direction) ? Sort.Direction.ASC : Sort.Direction.DESC;
        Pageable pageable = PageRequest.of(Math.max(page, 1) - 1, size <= 0 ? DEFAULT_PAGE_SIZE : Math.min(size, 100),
                Sort.by(dir, property).and(Sort.by(Sort.Direction.DESC, "id")));
        return postRepository.findAll(matching(criteria), pageable);
    }

    static Specification<Post> matching(PostSearchCriteria c) {
        Specification<Post> states = c.states().isEmpty()
                ? (root, q, cb) -> cb.notEqual(root.get("state"), PostState.DELETED)
                : (root, q, cb) -> root.get("state").in(c.states());
        if (c.authorId() == null) {
            return states;
        }
        Specification<Post> author = (root, q, cb) -> cb.equal(root.get("author").get("id"), c.authorId());
        return states.and(author);
    }

    /** Authors that have at least one post, by first name. */
    @Transactional(readOnly = true)
    @Cacheable(CacheConfig.POST_AUTHORS)
    public List<User> authors() {
        List<User> authors = new ArrayList<>(postRepository.findDistinctAuthors());
        authors.sort(Comparator.comparing(User::getFirstName, String.CASE_INSENSITIVE_ORDER));
        return authors;
    }

    @Transactional(readOnly = true)
    public Post get(Long id) {
        return postRepository.findById(id).orElseThrow(() -> new NotFoundException("Post", id));
    }

    /* ───────── create ───────── */

    @CacheEvict(cacheNames = CacheConfig.POST_AUTHORS, allEntries = true)
    public Post create(String title, User author) {
        String cleanTitle = title == null || title.isBlank() ? "New untitled post" : title.trim();
        if (cleanTitle.length() > MAX_TITLE) {
            throw new IllegalArgumentException("title should be at most " + MAX_TITLE + " character(s)");
        }
        String slug = Slugs.slugify(cleanTitle);
        String urlName = freeUrlName(slug);
        Post post = postRepository.save(Post.builder()
                .title(cleanTitle)
                .urlName(urlName)
                .author(author)
                .state(PostState.DRAFT)
                .build());
        log.info("Post {} created as '{}' by {}", post.getId(), urlName, author == null ? null : author.getId());
        return post;
    }

    public Post createUntitled(User author) {
        return create(null, author);
    }

    /** First of {@code slug}, {@code slug-(n+1)}, {@code slug-(n+2)}... that no post uses yet. */
    private String freeUrlName(String slug) {
        long existing = postRepository.countSlugFamily(slug);
        String candidate = Slugs.disambiguate(slug, existing);
        while (postRepository.existsByUrlName(candidate)) {
            existing++;
            candidate = Slugs.disambiguate(slug, existing);
        }
        return candidate;
    }

    /* ───────── editing ───────── */

    /**
     * Field errors of an edit, keyed by field name. Empty when the edit can be saved.
     */
    @Transactional(readOnly = true)
    public Map<String, List<String>> validate(Long postId, PostEdit edit) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        if (edit.title() != null) {
            if (edit.title().isBlank()) {
                add(errors, "title", "can't be blank");
            } else if (edit.title().length() > MAX_TITLE) {
                add(errors, "title", "should be at most " + MAX_TITLE + " character(s)");
            }
        }
        if (edit.urlName() != null) {
            if (edit.urlName().isBlank()) {
                add(errors, "urlName", "can't be blank");
            } else if (edit.urlName().length() > MAX_URL_NAME) {
                add(errors, "urlName", "should be at most " + MAX_URL_NAME + " character(s)");
            } else if (!edit.urlName().matches("[0-9a-z-]+")) {
                add(errors, "urlName", "may only contain lower-case letters, digits and dashes");
            } else if (postRepository.existsByUrlNameAndIdNot(edit.urlName(), postId)) {
                add(errors, "urlName", "has already been taken");
            }
        }
        if (edit.previewText() != null && edit.previewText().length() > MAX_PREVIEW) {
            add(errors, "previewText", "should be at most " + MAX_PREVIEW + " character(s)");
        }
        return errors;
    }

    /**
     * Applies an edit. Body HTML is sanitized; preview text falls back to the body's plain text.
     *
     * @throws IllegalArgumentException when {@link #validate} reports errors
     */
    public Post applyEdit(Long postId, PostEdit edit) {
        Map<String, List<String>> errors = validate(postId, edit);
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid post: " + errors);
        }
        Post post = get(postId);
        if (edit.title() != null) post.setTitle(edit.title().trim());
        if (edit.urlName() != null) post.setUrlName(edit.urlName());
        if (edit.body() != null) post.setBody(HtmlSanitizer.sanitize(edit.body()));
        if (edit.featuredPost() != null) post.setFeaturedPost(edit.featuredPost());
        if (edit.previewText() != null && !edit.previewText().isBlank()) {
            post.setPreviewText(edit.previewText().trim());
        } else if (post.getPreviewText() == null || post.getPreviewText().isBlank()) {
            post.setPreviewText(HtmlSanitizer.previewText(post.getBody(), MAX_PREVIEW));
        }
        log.debug("Post {} saved", postId);
        return post;
    }

    /* ───────── lifecycle ───────── */

    public Post publish(Long postId) {
        Post post = get(postId);
        if (post.getState() == PostState.DELETED) {
            throw new IllegalStateException("Deleted posts must be restored before publishing");
        }
        post.setState(PostState.PUBLISHED);
        post.setPublishedOn(LocalDateTime.now());
        log.info("Post {} published", postId);
        return post;
    }

    public Post restore(Long postId) {
        Post post = get(postId);
        post.setState(PostState.DRAFT);
        post.setPublishedOn(null);
        post.setDeletedOn(null);
        post.setFeaturedPost(false);
        log.info("Post {} restored to draft", postId);
        return post;
    }

    public Post delete(Long postId) {
        Post post = get(postId);
        post.setState(PostState.DELETED);
        post.setDeletedOn(LocalDateTime.now());
        post.setPublishedOn(null);
        post.setFeaturedPost(false);
        log.info("Post {} deleted", postId);
        return post;
    }

    private static void add(Map<String, List<String>> errors, String field, String message) {
        errors.computeIfAbsent(field, k -> new ArrayList<>()).add(message);
    }
}
