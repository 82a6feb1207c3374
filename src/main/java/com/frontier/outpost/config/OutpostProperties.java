package com.frontier.outpost.config;

import com.frontier.outpost.client.BulkImportMode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * The outpost fleet, bound from {@code app.outposts.*}.
 *
 * <pre>
 * app.outposts.nodes:
 *   - name: fishing-fort
 *     base-url: http://192.168.1.101:8000
 *     username: admin
 *     password: ...
 *     bulk-import: auto
 * </pre>
 */
@Getter
@Setter
public class OutpostProperties {

    private List<Node> nodes = new ArrayList<>();

    @Getter
    @Setter
    @ToString(exclude = "password")
    public static class Node {
        private String name;
        private String baseUrl;
        private String username;
        private String password;
        private BulkImportMode bulkImport = BulkImportMode.AUTO;

        public boolean hasCredentials() {
            return username != null && !username.isBlank() && password != null && !password.isEmpty();
        }
    }
}
