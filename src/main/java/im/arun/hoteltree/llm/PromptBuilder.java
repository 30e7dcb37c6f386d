package im.arun.hoteltree.llm;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Builds prompts for the hotel analyst, guest assistant and architect.
 */
public class PromptBuilder {

    public String buildAnalysisPrompt(String textContext) {
        return String.format("""
            You are an expert Hotel Data Analyst. Review the following structured hotel data and provide a summary of the hotel's offerings, identifying any key strengths or missing categories.

            Data (Markdown outline):
            %s""", textContext);
    }

    public String buildAuditPrompt(String jsonContext) {
        return String.format("""
            Act as a Senior Data Architect. Audit this hotel data structure for UX logic flaws.
            Focus on:
            1. Nested depth (is it too deep for a guest?)
            2. Missing prices in menus.
            3. Logical grouping errors.

            Data:
            ```json
            %s
            ```""", jsonContext);
    }

    public String buildChatSystemPrompt(String textContext, LocalDateTime now) {
        String day = now.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
        String date = now.format(DateTimeFormatter.ISO_LOCAL_DATE);
        String time = now.format(DateTimeFormatter.ofPattern("HH:mm"));
        return String.format("""
            IDENTITY: You are an Advanced Hotel Guest Assistant (AI). You are helpful, polite, and neutral.

            CURRENT CONTEXT:
            - Date/Day: %s, %s
            - Time: %s

            TONE: Professional, Helpful, Clear.

            CRITICAL INSTRUCTIONS:
            1. Answer solely based on the provided HOTEL DATABASE below. Do not invent information.
            2. TIME AWARENESS: If a user asks "What can I do now?", check the current context against event schedules and restaurant hours in the database.
            3. AGE AWARENESS: If a user mentions children, check the target age range in the data.

            HOTEL DATABASE:
            %s""", day, date, time, textContext);
    }

    public String buildArchitectPrompt(String userCommand, String jsonContext) {
        return String.format("""
            You are an AI Architect.

            TASK:
            Analyze the "Current Structure" against the "User Command".

            CRITICAL RULES:
            1. DUPLICATE CHECK: Before creating anything, check if it already exists in the JSON.
               - If it exists and matches the user's request: Return NO actions and explain in 'summary'.
               - If it exists but needs modification: Return an 'update' action instead of 'add'.
            2. HIERARCHY: Find the most logical 'targetId' (parent id) for new items. Use the "id" values shown in the structure.
            3. PROPERTY UPDATES: To set or update properties like 'Price', 'Opening Hours', 'Stars', or 'Cuisine', use a "features" object inside "data".
               - Example: "data": { "name": "Steakhouse", "features": { "Price": "50$", "Dress Code": "Casual" } }
            4. JSON ONLY: Return strictly valid JSON matching the schema.

            User Command: "%s"

            Current Structure:
            ```json
            %s
            ```

            RETURN JSON FORMAT:
            {
              "summary": "Explanation of what will be done.",
              "actions": [
                {
                  "type": "add" | "update" | "delete",
                  "targetId": "id of parent (for add) or id of node (for update/delete)",
                  "data": { "name": "...", "type": "...", "value": "...", "features": { "Key": "Value" } },
                  "reason": "Why this action is taken"
                }
              ]
            }""", userCommand, jsonContext);
    }
}
