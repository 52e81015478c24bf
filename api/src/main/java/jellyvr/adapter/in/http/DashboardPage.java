package jellyvr.adapter.in.http;

/**
 * HTML views for the browser login flow.
 */
final class DashboardPage {

    private static final String TEMPLATE = """
            <!DOCTYPE html>
            <html>
                <head>
                    <meta charset="utf-8" />
                    <title>JellyVR</title>%s
                </head>
                <body>
            %s
                </body>
            </html>
            """;
    private static final String REFRESH = "\n        <meta http-equiv=\"refresh\" content=\"5\" />";

    private DashboardPage() {}

    /**
     * Shown while the QuickConnect code waits for approval. Reloads itself.
     */
    static String pending(String code) {
        return page(true, """
                        <h1>Code: %s</h1>
                        <p>Enter this code under Quick Connect in your Jellyfin account settings.</p>\
                """.formatted(escape(code)));
    }

    /**
     * Credentials for HereSphere. The password is only known right after approval.
     */
    static String dashboard(String username, String password, String gatewayUrl) {
        final var credentials = new StringBuilder()
                .append("        <h1>User: ").append(escape(username)).append("</h1>\n");
        if (password != null) {
            credentials.append("        <h1>Pass: ").append(escape(password)).append("</h1>\n")
                    .append("        <p>Write this down, it will not be shown again.</p>\n");
        } else {
            credentials.append("        <p>Forgot the password? <a href=\"/?restart=true\">Log in again</a>.</p>\n");
        }
        credentials.append("        <h2><a href=\"")
                .append(escape(gatewayUrl))
                .append("/heresphere\">Heresphere!</a></h2>");
        return page(false, credentials.toString());
    }

    static String expired() {
        return page(false, """
                        <h1>The code expired</h1>
                        <p><a href="/?restart=true">Get a new code</a></p>\
                """);
    }

    static String unavailable() {
        return page(true, """
                        <h1>Jellyfin is unavailable</h1>
                        <p>Retrying in a few seconds.</p>\
                """);
    }

    private static String page(boolean refresh, String body) {
        return TEMPLATE.formatted(refresh ? REFRESH : "", body);
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        final var escaped = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            final var c = text.charAt(i);
            switch (c) {
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '&' -> escaped.append("&amp;");
                case '"' -> escaped.append("&quot;");
                case '\'' -> escaped.append("&#39;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
