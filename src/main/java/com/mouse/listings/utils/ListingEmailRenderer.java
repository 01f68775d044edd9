package com.mouse.listings.utils;

import com.mouse.listings.entity.ListingRecord;
import org.jsoup.nodes.Entities;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders matched listings as the HTML block dropped into the campaign template.
 */
@Component
public class ListingEmailRenderer {

    public static final String PLACEHOLDER = "*|TEMP_HTML|*";
    static final int DESCRIPTION_LIMIT = 300;
    private static final String NA = "N/A";

    private static final String EMPTY_STATE = """
            <div style="text-align: center; padding: 20px; background-color: #f9f9f9; border-radius: 5px;">
                <p style="color: #666; font-size: 16px; margin: 0;">No new listings match your criteria at this time.</p>
                <p style="color: #666; font-size: 14px; margin: 10px 0 0 0;">We'll notify you when new opportunities become available!</p>
            </div>
            """;

    private static final String LABEL = "<p style=\"text-align: left; margin: 0 0 5px 0; font-weight: bold; color: #007cba; font-size: 16px;\">%s</p>";
    private static final String VALUE = "<p style=\"text-align: left; margin: 0 0 15px 0; font-size: %s; color: #333;%s\">%s</p>";

    public String render(List<ListingRecord> listings) {
        if (listings == null || listings.isEmpty()) {
            return EMPTY_STATE;
        }
        StringBuilder html = new StringBuilder();
        int index = 1;
        for (ListingRecord listing : listings) {
            html.append("<div style=\"margin-bottom: 20px;\">")
                    .append("<h2 style=\"color: #007cba; font-size: 20px; margin: 0 0 10px 0;\">Business Opportunity #")
                    .append(index++)
                    .append("</h2>")
                    .append(renderListing(listing))
                    .append("</div>");
        }
        return html.toString();
    }

    /**
     * Replaces the placeholder in the template html; appends to the body when there is none.
     */
    public String merge(String templateHtml, String listingsHtml) {
        String template = templateHtml == null ? "" : templateHtml;
        if (template.contains(PLACEHOLDER)) {
            return template.replace(PLACEHOLDER, listingsHtml);
        }
        int bodyEnd = template.toLowerCase().lastIndexOf("</body>");
        if (bodyEnd >= 0) {
            return template.substring(0, bodyEnd) + listingsHtml + template.substring(bodyEnd);
        }
        return template + listingsHtml;
    }

    private String renderListing(ListingRecord listing) {
        String url = listing.getUrl() != null ? listing.getUrl() : "#";
        return "<div style=\"margin-bottom: 30px; padding: 20px; border: 2px solid #e0e0e0; border-radius: 8px; background-color: #fafafa;\">"
                + field("TITLE", "18px", " font-weight: bold;", listing.getTitle())
                + field("ASKING PRICE", "16px", " font-weight: bold;", listing.getAskingPrice())
                + field("Sellers Discretionary Earnings (SDE):", "16px", "", listing.getCashflow())
                + field("BROKER'S NAME", "16px", "", listing.getBrokerName())
                + field("BROKER'S PHONE", "16px", "", listing.getBrokerPhone())
                + field("DESCRIPTION", "14px", " line-height: 1.4;", truncate(listing.getDescription()))
                + "<div style=\"margin-bottom: 0;\"><p style=\"text-align: left; margin: 0; font-size: 16px;\">"
                + "<a href=\"" + Entities.escape(url) + "\" target=\"_blank\" style=\"color: #007cba; text-decoration: none; font-weight: bold;\">View Full Details →</a>"
                + "</p></div></div>";
    }

    private String field(String label, String fontSize, String extraStyle, String value) {
        return "<div style=\"margin-bottom: 15px;\">"
                + String.format(LABEL, Entities.escape(label))
                + String.format(VALUE, fontSize, extraStyle, Entities.escape(orNa(value)))
                + "</div>";
    }

    static String truncate(String description) {
        if (description == null || description.length() <= DESCRIPTION_LIMIT) {
            return description;
        }
        return description.substring(0, DESCRIPTION_LIMIT) + "...";
    }

    private static String orNa(String value) {
        return value == null || value.isBlank() ? NA : value;
    }
}
