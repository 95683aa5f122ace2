package com.newswebsite.service;

import com.newswebsite.dto.NewsRequest;
import com.newswebsite.dto.PageQuery;
import com.newswebsite.dto.PageResult;
import com.newswebsite.entity.News;
import com.newswebsite.exception.MediaUploadException;
import com.newswebsite.exception.ResourceNotFoundException;
import com.newswebsite.exception.ValidationException;
import com.newswebsite.repository.NewsRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class NewsServiceTest {

    @Autowired
    private NewsService newsService;

    @Autowired
    private NewsRepository newsRepository;

    @MockBean
    private MediaStorage mediaStorage;

    @MockBean
    private NotificationService notificationService;

    @BeforeEach
    void setUp() {
        newsRepository.deleteAll();
    }

    @Test
    void createDefaultsFlags() {
        News news = newsService.create(new NewsRequest("Opening night", "Body", "Culture", null, null), null);

        assertThat(news.getId()).isNotNull();
        assertThat(news.getIsActive()).isTrue();
        assertThat(news.getIsTrending()).isFalse();
        assertThat(news.getImageUrl()).isNull();
    }

    @Test
    void createWithMissingFieldPersistsNothing() {
        assertThatThrownBy(() -> newsService.create(new NewsRequest("Opening night", "Body", " ", null, null), null))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Title, content, and category are required fields");
        assertThat(newsRepository.count()).isZero();
    }

    @Test
    void createStoresUploadedImageUrl() {
        MockMultipartFile image = new MockMultipartFile("imageFile", "poster.jpg", "image/jpeg", new byte[]{1, 2});
        when(mediaStorage.upload(any(org.springframework.web.multipart.MultipartFile.class), eq(MediaKind.IMAGE)))
                .thenReturn("https://cdn.example/poster.jpg");

        News news = newsService.create(new NewsRequest("Poster", "Body", "Culture", true, true), image);

        assertThat(news.getImageUrl()).isEqualTo("https://cdn.example/poster.jpg");
    }

    @Test
    void failedUploadPersistsNothing() {
        MockMultipartFile image = new MockMultipartFile("imageFile", "poster.jpg", "image/jpeg", new byte[]{1, 2});
        when(mediaStorage.upload(any(org.springframework.web.multipart.MultipartFile.class), eq(MediaKind.IMAGE)))
                .thenThrow(new MediaUploadException("Error uploading image file", "provider down"));

        assertThatThrownBy(() -> newsService.create(new NewsRequest("Poster", "Body", "Culture", null, null), image))
                .isInstanceOf(MediaUploadException.class);
        assertThat(newsRepository.count()).isZero();
    }

    @Test
    void toggleTrendingFlipsOnlyThatFlag() {
        News news = newsService.create(new NewsRequest("Opening night", "Body", "Culture", false, true), null);

        News toggled = newsService.toggleTrending(news.getId());

        assertThat(toggled.getIsTrending()).isTrue();
        assertThat(toggled.getIsActive()).isTrue();
        assertThat(newsService.toggleTrending(news.getId()).getIsTrending()).isFalse();
    }

    @Test
    void toggleActiveFlipsOnlyThatFlag() {
        News news = newsService.create(new NewsRequest("Opening night", "Body", "Culture", true, true), null);

        News toggled = newsService.toggleActive(news.getId());

        assertThat(toggled.getIsActive()).isFalse();
        assertThat(toggled.getIsTrending()).isTrue();
    }

    @Test
    void toggleUnknownIdIsNotFound() {
        assertThatThrownBy(() -> newsService.toggleActive(987654L))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("News not found");
    }

    @Test
    void inactiveNewsIsHiddenFromAnonymousReads() {
        News news = newsService.create(new NewsRequest("Draft", "Body", "Culture", null, false), null);

        assertThatThrownBy(() -> newsService.get(news.getId(), false)).isInstanceOf(ResourceNotFoundException.class);
        assertThat(newsService.get(news.getId(), true).getTitle()).isEqualTo("Draft");
    }

    @Test
    void publicListingShowsOnlyActiveNews() {
        newsService.create(new NewsRequest("Live", "Body", "Culture", true, true), null);
        newsService.create(new NewsRequest("Hidden", "Body", "Culture", true, false), null);

        PageResult<News> page = newsService.listPublic(PageQuery.of(1, 10), null, null);

        assertThat(page.getItems()).extracting(News::getTitle).containsExactly("Live");
        assertThat(page.getPagination().total()).isEqualTo(1);
        assertThat(newsService.trending()).extracting(News::getTitle).containsExactly("Live");
    }

    @Test
    void adminListingFiltersAndSearches() {
        newsService.create(new NewsRequest("Festival opens", "Body", "Culture", false, true), null);
        newsService.create(new NewsRequest("Bus timetable", "Body", "Travel", false, false), null);

        PageResult<News> search = newsService.list(new PageQuery(1, 10, "FESTIVAL", null, null), null, null, null);
        PageResult<News> inactive = newsService.list(PageQuery.of(1, 10), "false", null, null);

        assertThat(search.getItems()).extracting(News::getTitle).containsExactly("Festival opens");
        assertThat(inactive.getItems()).extracting(News::getTitle).containsExactly("Bus timetable");
    }

    @Test
    void searchTreatsPercentAndUnderscoreLiterally() {
        newsService.create(new NewsRequest("100% fresh", "Body", "Food", null, null), null);
        newsService.create(new NewsRequest("1000 things", "Body", "Lists", null, null), null);
        newsService.create(new NewsRequest("abc", "Body", "Misc", null, null), null);
        newsService.create(new NewsRequest("snake_case naming", "Body", "Tech", null, null), null);

        assertThat(newsService.list(new PageQuery(1, 10, "100%", null, null), null, null, null).getItems())
                .extracting(News::getTitle).containsExactly("100% fresh");
        assertThat(newsService.list(new PageQuery(1, 10, "a_c", null, null), null, null, null).getItems())
                .isEmpty();
        assertThat(newsService.list(new PageQuery(1, 10, "E_C", null, null), null, null, null).getItems())
                .extracting(News::getTitle).containsExactly("snake_case naming");
    }

    @Test
    void partialUpdateKeepsOmittedFields() {
        News news = newsService.create(new NewsRequest("Old", "Body", "Culture", null, null), null);

        News updated = newsService.update(news.getId(), new NewsRequest("New", null, null, null, null), null);

        assertThat(updated.getTitle()).isEqualTo("New");
        assertThat(updated.getCategory()).isEqualTo("Culture");
    }

    @Test
    void deleteReturnsIdAndTitle() {
        News news = newsService.create(new NewsRequest("Gone", "Body", "Culture", null, null), null);

        Map<String, Object> deleted = newsService.delete(news.getId());

        assertThat(deleted).containsEntry("id", news.getId()).containsEntry("title", "Gone");
        assertThat(newsRepository.existsById(news.getId())).isFalse();
    }
}
