package com.techlab.mailmerge.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.techlab.mailmerge.exception.DataSourceConnectionException;
import com.techlab.mailmerge.exception.ResourceNotFoundException;
import com.techlab.mailmerge.model.Row;
import com.techlab.mailmerge.model.TableRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

public class GristDataSourceTest {

    private static final String SERVER = "https://grist.example.test";

    private MockRestServiceServer server;
    private GristDataSource dataSource;

    @BeforeEach
    public void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(SERVER);
        server = MockRestServiceServer.bindTo(builder).build();
        RestClient client = builder.build();
        dataSource = new GristDataSource(client, client, new ObjectMapper(), "doc123");
    }

    @Test
    public void testListTables() {
        server.expect(requestTo(SERVER + "/api/docs/doc123/tables"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"tables\":[{\"id\":\"Agents\",\"fields\":{}},{\"id\":\"Services\"}]}",
                        MediaType.APPLICATION_JSON));

        List<TableRef> tables = dataSource.listTables();

        assertThat(tables).extracting(TableRef::getId).containsExactly("Agents", "Services");
        server.verify();
    }

    @Test
    public void testListColumnsSkipsHelpers() {
        server.expect(requestTo(SERVER + "/api/docs/doc123/tables/Agents/columns"))
                .andRespond(withSuccess("{\"columns\":[{\"id\":\"Nom\"},{\"id\":\"gristHelper_Display\"},{\"id\":\"Pdf_print\"}]}",
                        MediaType.APPLICATION_JSON));

        assertThat(dataSource.listColumns("Agents")).containsExactly("Nom", "Pdf_print");
    }

    @Test
    public void testListRowsWithLimit() {
        server.expect(requestTo(SERVER + "/api/docs/doc123/tables/Agents/records?limit=2"))
                .andRespond(withSuccess("{\"records\":["
                                + "{\"id\":1,\"fields\":{\"Nom\":\"Dupont\",\"Age\":42,\"Pdf_print\":true,\"Ville\":null}},"
                                + "{\"id\":2,\"fields\":{\"Nom\":\"Martin\",\"Montant\":12.5}}]}",
                        MediaType.APPLICATION_JSON));

        List<Row> rows = dataSource.listRows("Agents", 2);

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).get("Nom")).isEqualTo("Dupont");
        assertThat(rows.get(0).get("Age")).isEqualTo(42);
        assertThat(rows.get(0).get("Pdf_print")).isEqualTo(true);
        assertThat(rows.get(0).has("Ville")).isTrue();
        assertThat(rows.get(0).columns()).containsExactly("Nom", "Age", "Pdf_print", "Ville");
        assertThat(rows.get(1).get("Montant")).isEqualTo(12.5);
        assertThat(rows.get(1).has("Age")).isFalse();
    }

    @Test
    public void testListAllRows() {
        server.expect(requestTo(SERVER + "/api/docs/doc123/tables/Agents/records"))
                .andRespond(withSuccess("{\"records\":[]}", MediaType.APPLICATION_JSON));

        assertThat(dataSource.listRows("Agents")).isEmpty();
    }

    @Test
    public void testUnknownTable() {
        server.expect(requestTo(SERVER + "/api/docs/doc123/tables/Nope/records"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> dataSource.listRows("Nope")).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    public void testRejectedCredentials() {
        server.expect(requestTo(SERVER + "/api/docs/doc123/tables"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThatThrownBy(() -> dataSource.listTables()).isInstanceOf(DataSourceConnectionException.class);
    }

    @Test
    public void testConnection() {
        server.expect(requestTo(SERVER + "/api/docs/doc123")).andRespond(withSuccess());
        assertThat(dataSource.testConnection()).isTrue();

        server.reset();
        server.expect(requestTo(SERVER + "/api/docs/doc123")).andRespond(withStatus(HttpStatus.FORBIDDEN));
        assertThat(dataSource.testConnection()).isFalse();
    }
}
