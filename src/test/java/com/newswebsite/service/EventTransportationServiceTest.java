package com.newswebsite.service;

import com.newswebsite.dto.EventRequest;
import com.newswebsite.dto.PageQuery;
import com.newswebsite.dto.PageResult;
import com.newswebsite.dto.TransportationRequest;
import com.newswebsite.entity.Event;
import com.newswebsite.entity.Transportation;
import com.newswebsite.exception.ResourceNotFoundException;
import com.newswebsite.exception.ValidationException;
import com.newswebsite.repository.EventRepository;
import com.newswebsite.repository.TransportationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class EventTransportationServiceTest {

    @Autowired
    private EventService eventService;

    @Autowired
    private TransportationService transportationService;

    @Autowired
    private EventRepository eventRepository;

    @Autowired
    private TransportationRepository transportationRepository;

    @MockBean
    private NotificationService notificationService;

    @MockBean
    private MediaStorage mediaStorage;

    @BeforeEach
    void setUp() {
        eventRepository.deleteAll();
        transportationRepository.deleteAll();
    }

    @Test
    void upcomingAndPastSplitOnNow() {
        LocalDate today = LocalDate.now();
        event("Yesterday", today.minusDays(1));
        event("Next week", today.plusDays(7));

        assertThat(eventService.list(PageQuery.of(1, 10), null, "true", null).getItems())
                .extracting(Event::getTitle).containsExactly("Next week");
        assertThat(eventService.list(PageQuery.of(1, 10), null, null, "true").getItems())
                .extracting(Event::getTitle).containsExactly("Yesterday");
        assertThat(eventService.list(PageQuery.of(1, 10), null, null, null).getItems())
                .extracting(Event::getTitle).containsExactly("Yesterday", "Next week");
    }

    @Test
    void eventRequiresTitleDescriptionAndDate() {
        assertThatThrownBy(() -> eventService.create(new EventRequest("Gig", null, "2030-01-01", null, null, null, null)))
                .isInstanceOf(ValidationException.class);
        assertThat(eventRepository.count()).isZero();
    }

    @Test
    void eventPaginationReportsTotals() {
        LocalDate base = LocalDate.now().plusDays(1);
        for (int i = 0; i < 5; i++) {
            event("Event " + i, base.plusDays(i));
        }

        PageResult<Event> page = eventService.listPublic(PageQuery.of(2, 2));

        assertThat(page.getItems()).extracting(Event::getTitle).containsExactly("Event 2", "Event 3");
        assertThat(page.getPagination().total()).isEqualTo(5);
        assertThat(page.getPagination().pages()).isEqualTo(3);
    }

    @Test
    void transportationPublicListIsActiveByOrder() {
        transport("Bus", "bus", 2, true);
        transport("Train", "train", 1, true);
        transport("Ferry", "boat", 0, false);

        assertThat(transportationService.listPublic())
                .extracting(Transportation::getTitle).containsExactly("Train", "Bus");
    }

    @Test
    void transportationToggleAndDelete() {
        Transportation bus = transport("Bus", "bus", 1, true);

        assertThat(transportationService.toggleActive(bus.getId()).getIsActive()).isFalse();
        assertThatThrownBy(() -> transportationService.get(bus.getId(), false))
                .isInstanceOf(ResourceNotFoundException.class);

        Map<String, Object> deleted = transportationService.delete(bus.getId());
        assertThat(deleted).containsEntry("id", bus.getId());
        assertThat(transportationRepository.count()).isZero();
    }

    private void event(String title, LocalDate date) {
        eventService.create(new EventRequest(title, "Description", date.toString(), "Hall", false, true, null));
    }

    private Transportation transport(String title, String type, int order, boolean active) {
        TransportationRequest request = new TransportationRequest();
        request.setTitle(title);
        request.setType(type);
        request.setIcon(type);
        request.setOrder(order);
        request.setIsActive(active);
        return transportationService.create(request);
    }
}
