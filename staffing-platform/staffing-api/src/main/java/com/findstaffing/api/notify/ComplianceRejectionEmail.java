package com.findstaffing.api.notify;

import com.findstaffing.core.domain.Agency;
import com.findstaffing.core.domain.ComplianceType;
import org.springframework.web.util.HtmlUtils;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;

/**
 * Message telling an agency owner that a compliance document was rejected.
 */
public final class ComplianceRejectionEmail {

    private ComplianceRejectionEmail() {}

    public static EmailMessage compose(String to,
                                       String recipientName,
                                       Agency agency,
                                       ComplianceType type,
                                       String reason,
                                       String siteUrl) {
        String dashboardUrl = dashboardUrl(siteUrl, agency.getSlug());
        String subject = "Compliance Document Update - " + agency.getName();
        return new EmailMessage(to, subject,
                html(recipientName, agency.getName(), type, reason, dashboardUrl),
                text(recipientName, agency.getName(), type, reason, dashboardUrl));
    }

    static String dashboardUrl(String siteUrl, String slug) {
        String base = siteUrl == null ? "" : siteUrl.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/dashboard/agency/" + UriUtils.encodePathSegment(slug, StandardCharsets.UTF_8) + "/compliance";
    }

    private static String greeting(String recipientName) {
        return recipientName == null || recipientName.isBlank() ? "Hello," : "Hi " + recipientName + ",";
    }

    private static String html(String recipientName, String agencyName, ComplianceType type,
                               String reason, String dashboardUrl) {
        return """
                <!DOCTYPE html>
                <html lang="en">
                <head><meta charset="UTF-8"><title>Compliance Document Update - %s</title></head>
                <body style="font-family: Arial, sans-serif; color: #111827;">
                  <h2>Compliance Document Update</h2>
                  <p>%s</p>
                  <p>We have reviewed the <strong>%s</strong> document you uploaded for <strong>%s</strong>. \
                Unfortunately, we are unable to verify this document at this time.</p>
                  <p><strong>Document Type</strong><br>%s</p>
                  <p><strong>Description</strong><br>%s</p>
                  <div style="background-color: #fef2f2; border: 1px solid #fecaca; padding: 16px;">
                    <h3 style="color: #991b1b;">Reason for Rejection</h3>
                    <p style="white-space: pre-wrap;">%s</p>
                  </div>
                  <p>To maintain your agency's compliance status, please upload a new document that addresses the concerns noted above.</p>
                  <p><a href="%s">Upload New Document</a></p>
                </body>
                </html>
                """.formatted(
                HtmlUtils.htmlEscape(type.displayName()),
                HtmlUtils.htmlEscape(greeting(recipientName)),
                HtmlUtils.htmlEscape(type.displayName()),
                HtmlUtils.htmlEscape(agencyName),
                HtmlUtils.htmlEscape(type.displayName()),
                HtmlUtils.htmlEscape(type.description()),
                HtmlUtils.htmlEscape(reason),
                HtmlUtils.htmlEscape(dashboardUrl));
    }

    private static String text(String recipientName, String agencyName, ComplianceType type,
                               String reason, String dashboardUrl) {
        return """
                %s

                We have reviewed the %s document you uploaded for %s. Unfortunately, we are unable to verify this document at this time.

                Reason for Rejection:
                %s

                To maintain your agency's compliance status, please upload a new document that addresses the concerns noted above:
                %s
                """.formatted(greeting(recipientName), type.displayName(), agencyName, reason, dashboardUrl);
    }
}
