package com.budgetaudit.processing.ai;

import com.budgetaudit.shared.dto.ExtractRequest;

/**
 * Renders the extraction prompt. The window text is embedded verbatim so that reported spans
 * line up with {@link ExtractRequest#getSectionText()}.
 */
public class ExtractionPromptBuilder {

    private static final String TEMPLATE = String.join("\n",
            "你是财政公开文档的信息抽取助手。任务编号：%s。",
            "请从下面的文本中抽取同时包含“预算数字、决算数字、比较结论”的语句。",
            "",
            "约束：",
            "1. 三者必须同时出现才输出；",
            "2. 逐字抄写原文中的数字和短语，不做改写或格式化；",
            "3. 每个字段给出 [start, end) 字符位置，从 0 开始，基于下面“文本内容”的第一个字符计数；",
            "4. 只抽取，不判断大小关系；",
            "5. 紧随其后的“主要原因/增减原因/变动原因”填入 reason_text 和 reason_span，没有则为 null；",
            "6. 不要抽取与上年比较（同比、比上年、较上年）的语句。",
            "",
            "结论短语示例：决算数大于预算数、决算数小于预算数、决算数等于预算数、决算数基本持平预算数。",
            "",
            "只返回 JSON，不要使用 Markdown 代码块，格式：",
            "{\"hits\": [{\"budget_text\": \"\", \"budget_span\": [0, 0], \"final_text\": \"\", \"final_span\": [0, 0],",
            " \"stmt_text\": \"\", \"stmt_span\": [0, 0], \"reason_text\": null, \"reason_span\": null, \"item_title\": \"\"}]}",
            "",
            "文本内容：",
            "%s");

    public String build(ExtractRequest request) {
        return String.format(TEMPLATE, request.getTask(), request.getSectionText());
    }
}
