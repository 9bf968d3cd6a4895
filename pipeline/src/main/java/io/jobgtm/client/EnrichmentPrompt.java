package io.jobgtm.client;

import io.jobgtm.model.ScrapedItem;

final class EnrichmentPrompt {

    private static final String TEMPLATE = """
            You are a job listing analysis expert. Analyze the following job listing and provide structured enrichment data.

            Job Listing:
            Company: %s
            Role: %s
            Location: %s
            Salary: %s
            Description: %s...
            Employment Type: %s
            Posted: %s
            About Company: %s

            Please provide the following analysis in JSON format:

            {
              "currency_normalization": {"detected_currency": "USD|EUR|GBP|INR|etc", "min_salary_usd": <number or null>,
                "max_salary_usd": <number or null>, "conversion_rate": <number>, "confidence": <0.0-1.0>},
              "seniority_level": {"normalized": "Entry|Junior|Mid|Senior|Lead|Principal|Staff|Executive",
                "confidence": <0.0-1.0>, "reasoning": "<brief explanation>"},
              "work_arrangement": {"normalized": "On-site|Remote|Hybrid", "confidence": <0.0-1.0>, "details": "<details>"},
              "scam_detection": {"score": <0-100>, "indicators": ["red", "flags"], "is_likely_scam": <true|false>},
              "skills_extraction": {"skills": [{"skill": "React", "normalized": "ReactJS", "category": "Frontend", "experience": "3+ years"}]},
              "tech_stack": {"technologies": ["React", "Node.js"], "frameworks": ["Next.js"], "tools": ["Docker"]},
              "location_normalization": {"city": "<city>", "state": "<state>", "country": "<country>",
                "timezone": "<timezone>", "is_remote": <true|false>},
              "company_insights": {"industry": "<industry>", "company_size": "<size estimate>", "notable_info": "<facts>"},
              "benefits": {"has_stock_options": <true|false>, "stock_details": "<equity details>", "other_benefits": ["benefit"]},
              "role_classification": {"primary_role": "Software Engineer|Data Scientist|etc",
                "role_category": "Engineering|Product|etc", "is_management": <true|false>}
            }

            IMPORTANT:
            - Return ONLY valid JSON, no additional text or markdown
            - Use null for missing/unknown values
            - Be conservative with confidence scores
            - Normalize similar technologies (ReactJS=React, NodeJS=Node.js, Postgres=PostgreSQL)
            - For currencies use current approximate exchange rates
            """;

    private EnrichmentPrompt() {
    }

    static String build(ScrapedItem job) {
        return TEMPLATE.formatted(
                orNa(job.companyTitle(), 0),
                orNa(job.jobRole(), 0),
                orNa(job.jobLocation(), 0),
                orNa(job.salaryRange(), 0),
                orNa(job.jobDescriptionFull(), 1000),
                orNa(job.employmentType(), 0),
                orNa(job.datePosted(), 0),
                orNa(job.aboutCompany(), 500));
    }

    private static String orNa(String value, int max) {
        if (value == null || value.isBlank()) return "N/A";
        return max > 0 && value.length() > max ? value.substring(0, max) : value;
    }
}
