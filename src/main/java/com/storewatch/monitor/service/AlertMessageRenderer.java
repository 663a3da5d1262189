package com.storewatch.monitor.service;

import com.storewatch.monitor.config.MonitorProperties;
import com.storewatch.monitor.model.Alert;
import com.storewatch.monitor.model.AlertCategory;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.util.Locale;

/**
 * Renders the subject and HTML body of alert e-mails.
 */
@Singleton
public class AlertMessageRenderer {

    public record RenderedMessage(String subject, String html) {
    }

    private static final String FOOTER =
            "<p style=\"color:#666; font-size:13px; margin-top:30px;\">StoreWatch &bull; Visual Store Monitoring</p>";

    private static final String CTA_STYLE =
            "display:inline-block; background:#ef4444; color:white; padding:16px 32px; "
                    + "text-decoration:none; border-radius:8px; font-weight:bold;";

    private final MonitorProperties properties;

    @Inject
    public AlertMessageRenderer(MonitorProperties properties) {
        this.properties = properties;
    }

    public RenderedMessage render(String storeUrl, Alert alert) {
        return alert.getCategory() == AlertCategory.AVAILABILITY
                ? renderDown(storeUrl)
                : renderVisual(storeUrl, alert);
    }

    // ---- Availability ------------------------------------------------------

    private RenderedMessage renderDown(String storeUrl) {
        String url = escape(storeUrl);
        String html = """
                <h1 style="color:#ef4444;">Site Down Alert</h1>
                <p>Your store <strong><a href="%s">%s</a></strong> has been unreachable for multiple checks.</p>
                <p>Please check your hosting/server immediately.</p>
                <p><a href="%s" style="%s">View in Dashboard</a></p>
                %s
                """.formatted(url, url, escape(properties.getDashboardUrl()), CTA_STYLE, FOOTER);

        return new RenderedMessage("Your store is DOWN: " + storeUrl, html);
    }

    // ---- Visual ------------------------------------------------------------

    private RenderedMessage renderVisual(String storeUrl, Alert alert) {
        String url = escape(storeUrl);
        String percentage = formatPercentage(alert.getDiffPercentage());

        StringBuilder shots = new StringBuilder();
        shots.append(screenshot("Before", alert.getBeforeUrl()));
        shots.append(screenshot("After", alert.getAfterUrl()));
        if (alert.getDiffUrl() != null) {
            shots.append(screenshot("Highlighted Diff", alert.getDiffUrl()));
        }

        String alertLink = properties.getDashboardUrl() + "/alerts/" + alert.getId();

        String html = """
                <!DOCTYPE html>
                <html>
                <head><meta charset="utf-8"><title>StoreWatch Alert</title></head>
                <body style="background:#0a0a0a; color:#fff; font-family:system-ui,sans-serif; margin:0; padding:0;">
                  <div style="max-width:600px; margin:40px auto; padding:20px;">
                    <h1 style="color:#ef4444;">StoreWatch Alert</h1>
                    <p><strong>Store:</strong> <a href="%s" style="color:#60a5fa;">%s</a></p>
                    <p style="font-size:26px; font-weight:bold; color:#f59e0b;">Visual change detected: %s%%</p>
                    <div style="margin:25px 0;">%s</div>
                    <a href="%s" style="%s">VIEW IN DASHBOARD &rarr;</a>
                    %s
                  </div>
                </body>
                </html>
                """.formatted(url, url, percentage, shots, escape(alertLink), CTA_STYLE, FOOTER);

        return new RenderedMessage("Visual change on " + storeUrl + " – " + percentage + "%", html);
    }

    private static String screenshot(String label, String src) {
        return "<div><p><strong>" + label + "</strong></p><img src=\"" + escape(src)
                + "\" style=\"max-width:100%; border:3px solid #333; border-radius:8px;\" alt=\"" + label + "\"></div>";
    }

    static String formatPercentage(Double percentage) {
        if (percentage == null) {
            return "0";
        }
        if (percentage == Math.rint(percentage)) {
            return String.valueOf(percentage.longValue());
        }
        return String.format(Locale.ROOT, "%.2f", percentage).replaceAll("0$", "");
    }

    private static String escape(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }
}
