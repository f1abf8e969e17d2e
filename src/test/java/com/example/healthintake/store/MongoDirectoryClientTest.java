package com.example.healthintake.store;

import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MongoDirectoryClientTest {

    @Mock
    private MongoTemplate mongo;

    private MongoDirectoryClient client;

    @BeforeEach
    void setUp() {
        client = new MongoDirectoryClient(mongo);
    }

    @Test
    void testAccentInsensitive_MatchesWithAndWithoutAccents() {
        Pattern pattern = Pattern.compile("^" + MongoDirectoryClient.accentInsensitive("cardiologia") + "$",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

        assertTrue(pattern.matcher("Cardiología").matches());
        assertTrue(pattern.matcher("cardiologia").matches());
        assertFalse(pattern.matcher("Neurología").matches());
    }

    @Test
    void testFindDoctors_FiltersAndLimits() {
        // Given
        when(mongo.find(any(Query.class), eq(Document.class), eq("doctores")))
                .thenReturn(List.of(new Document("doctor_id", "DOC-0001")));

        // When
        List<Map<String, Object>> doctors = client.findDoctors(
                Map.of("especialidad", "Cardiología", "modalidad", "any"), 5);

        // Then
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongo).find(query.capture(), eq(Document.class), eq("doctores"));
        String filter = query.getValue().getQueryObject().toJson();
        assertTrue(filter.contains("especialidad"));
        assertFalse(filter.contains("tipo_consulta"));
        assertEquals(5, query.getValue().getLimit());
        assertEquals("DOC-0001", doctors.get(0).get("doctor_id"));
    }

    @Test
    void testFindSchedules_NoDoctorsSkipsQuery() {
        assertTrue(client.findSchedules(List.of(), Map.of(), 20).isEmpty());
        verifyNoInteractions(mongo);
    }

    @Test
    void testAppendEvent_StampsUserAndTime() {
        // When
        client.appendEvent("user-1", Map.of("type", "RiskEscalated"));

        // Then
        ArgumentCaptor<Document> event = ArgumentCaptor.forClass(Document.class);
        verify(mongo).insert(event.capture(), eq("events"));
        assertEquals("user-1", event.getValue().get("userId"));
        assertEquals("RiskEscalated", event.getValue().get("type"));
        assertNotNull(event.getValue().get("ts"));
    }
}
