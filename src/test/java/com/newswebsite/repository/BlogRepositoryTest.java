package com.newswebsite.repository;

import com.newswebsite.entity.Blog;
import com.newswebsite.entity.Role;
import com.newswebsite.entity.User;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
class BlogRepositoryTest {

    @Autowired
    private BlogRepository blogRepository;

    @Autowired
    private UserRepository userRepository;

    @Test
    void toggleFeaturedInvertsFlagAndStampsUpdate() {
        Blog blog = blogRepository.saveAndFlush(blog("Notes", null));
        LocalDateTime stamp = LocalDateTime.of(2030, 1, 1, 12, 0);

        int updated = blogRepository.toggleFeatured(blog.getId(), stamp);

        Blog reloaded = blogRepository.findById(blog.getId()).orElseThrow();
        assertThat(updated).isEqualTo(1);
        assertThat(reloaded.getIsFeatured()).isTrue();
        assertThat(reloaded.getIsActive()).isTrue();
        assertThat(reloaded.getUpdatedAt()).isEqualTo(stamp);
    }

    @Test
    void toggleMissingRowAffectsNothing() {
        assertThat(blogRepository.toggleActive(123456L, LocalDateTime.now())).isZero();
    }

    @Test
    void clearAuthorDetachesOnlyThatUsersBlogs() {
        User writer = userRepository.saveAndFlush(user("writer@example.se"));
        User other = userRepository.saveAndFlush(user("other@example.se"));
        Blog mine = blogRepository.saveAndFlush(blog("Mine", writer));
        Blog theirs = blogRepository.saveAndFlush(blog("Theirs", other));

        assertThat(blogRepository.clearAuthor(writer.getId())).isEqualTo(1);

        assertThat(blogRepository.findById(mine.getId()).orElseThrow().getAuthorId()).isNull();
        assertThat(blogRepository.findById(theirs.getId()).orElseThrow().getAuthorId()).isEqualTo(other.getId());
    }

    @Test
    void featuredListSkipsInactiveBlogs() {
        Blog live = blog("Live", null);
        live.setIsFeatured(true);
        Blog hidden = blog("Hidden", null);
        hidden.setIsFeatured(true);
        hidden.setIsActive(false);
        blogRepository.saveAndFlush(live);
        blogRepository.saveAndFlush(hidden);

        assertThat(blogRepository.findByIsActiveTrueAndIsFeaturedTrueOrderByCreatedAtDesc())
                .extracting(Blog::getTitle).containsExactly("Live");
    }

    private static Blog blog(String title, User author) {
        Blog blog = new Blog();
        blog.setTitle(title);
        blog.setContent("Body");
        blog.setCategory("Travel");
        blog.setAuthor(author);
        return blog;
    }

    private static User user(String email) {
        User user = new User();
        user.setEmail(email);
        user.setPassword("hash");
        user.setRole(Role.EDITOR);
        return user;
    }
}
