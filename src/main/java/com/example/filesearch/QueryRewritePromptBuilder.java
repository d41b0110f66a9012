package com.example.filesearch;

import org.springframework.stereotype.Component;

@Component
public class QueryRewritePromptBuilder {

    public String build(String query) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Extract the main topic from the query by removing all unnecessary words.\n");
        prompt.append("Return only the extracted topic without any additional text or explanation.\n\n");
        prompt.append("Examples:\n");
        prompt.append("Input: give me the document that talks about Review and Evaluation of Clinical Data\n");
        prompt.append("Output: Review and Evaluation of Clinical Data\n\n");
        prompt.append("Input: there is a document that talks about office of state fire marshal give it to me\n");
        prompt.append("Output: office of state fire marshal\n\n");
        prompt.append("Input: I need to find information about Hanford RCRA permits in the documents\n");
        prompt.append("Output: Hanford RCRA permits\n\n");
        prompt.append("Input: ").append(query).append('\n');
        prompt.append("Output:");
        return prompt.toString();
    }
}
