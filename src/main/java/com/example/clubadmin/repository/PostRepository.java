package com.example.clubadmin.repository;

import com.example.clubadmin.domain.Post;
import com.example.clubadmin.domain.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PostRepository extends JpaRepository<Post, Long>, JpaSpecificationExecutor<Post> {

    /** Posts whose slug equals {@code slug} or starts with {@code slug-}. */
    @Query("select count(p) from Post p where p.urlName = :slug or p.urlName like concat(:slug, '-%')")
    long countSlugFamily(@Param("slug") String slug);

    boolean existsByUrlName(String urlName);

    boolean existsByUrlNameAndIdNot(String urlName, Long id);

    @Query("select distinct p.author from Post p where p.author is not null")
    List<User> findDistinctAuthors();
}
