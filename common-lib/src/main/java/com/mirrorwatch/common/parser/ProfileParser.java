package com.mirrorwatch.common.parser;

import com.mirrorwatch.common.exception.MarkupParseException;
import com.mirrorwatch.common.model.ProfileContent;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Extracts the profile name and the number of timeline posts from a rendered profile page.
 */
public class ProfileParser {

    /**
     * @throws MarkupParseException when the profile card or the timeline is missing
     */
    public ProfileContent parse(String html) {
        Document document = Jsoup.parse(html == null ? "" : html);

        Element card = document.selectFirst(".profile-card-username");
        if (card == null) {
            throw new MarkupParseException("No profile-card found");
        }
        Element timeline = document.selectFirst(".timeline");
        if (timeline == null) {
            throw new MarkupParseException("No timeline found");
        }
        int posts = timeline.select(".timeline-item").size();
        return new ProfileContent(card.text().trim(), posts);
    }
}
