package io.jobgtm.mock;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic job cards: the same scraper and page always produce the same cards, so repeated
 * scrapes exercise the duplicate path of ingestion.
 */
final class MockJobCards {

    private static final String[] COMPANIES = {"Acme", "Globex", "Initech", "Umbrella", "Hooli", "Stark Industries"};
    private static final String[] ROLES = {"Backend Engineer", "Data Scientist", "Product Manager",
            "Frontend Engineer", "Site Reliability Engineer"};
    private static final String[] LOCATIONS = {"New York, NY", "Remote", "Berlin, Germany", "London, UK", "N/A"};
    private static final String[] TYPES = {"Full-time", "Contract", "Part-time"};

    private MockJobCards() {
    }

    static List<Map<String, Object>> page(String scraper, int page, int pageSize) {
        List<Map<String, Object>> cards = new ArrayList<>(pageSize);
        for (int i = 0; i < pageSize; i++) {
            int n = (page - 1) * pageSize + i;
            int min = 80_000 + (n % 7) * 10_000;
            Map<String, Object> card = new LinkedHashMap<>();
            card.put("companyTitle", COMPANIES[n % COMPANIES.length]);
            card.put("jobRole", ROLES[n % ROLES.length]);
            card.put("jobLocation", LOCATIONS[n % LOCATIONS.length]);
            card.put("employmentType", TYPES[n % TYPES.length]);
            card.put("salaryRange", "$" + min / 1000 + "k - $" + (min + 40_000) / 1000 + "k");
            card.put("minSalary", (double) min);
            card.put("maxSalary", (double) min + 40_000);
            card.put("requiredExperience", (1 + n % 8) + "+ years");
            card.put("seniorityLevel", n % 3 == 0 ? "Senior" : "Mid");
            card.put("jobDescription", "Build and operate services at " + COMPANIES[n % COMPANIES.length] + ".");
            card.put("datePosted", (n % 14 + 1) + " days ago");
            card.put("postingUrl", postingUrl(scraper, n));
            card.put("hiringTeam", "Platform");
            card.put("aboutCompany", COMPANIES[n % COMPANIES.length] + " makes things.");
            cards.add(card);
        }
        return cards;
    }

    static String postingUrl(String scraper, int n) {
        return "https://jobs.example.com/" + scraper + "/" + n;
    }
}
