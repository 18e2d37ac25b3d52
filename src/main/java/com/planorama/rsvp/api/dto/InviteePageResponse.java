package com.planorama.rsvp.api.dto;

import com.planorama.rsvp.service.result.InviteePage;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Response DTO for one page of invitees.
 *
 * @author Planorama Team
 */
public class InviteePageResponse {

    private List<InviteeResponse> tokens;
    private Pagination pagination;

    public InviteePageResponse() {
    }

    public static InviteePageResponse fromPage(InviteePage page) {
        InviteePageResponse response = new InviteePageResponse();
        response.setTokens(page.getItems().stream()
                .map(InviteeResponse::fromView)
                .collect(Collectors.toList()));
        response.setPagination(new Pagination(page.getPage(), page.getLimit(), page.getTotal(), page.getTotalPages()));
        return response;
    }

    // Getters and setters
    public List<InviteeResponse> getTokens() {
        return tokens;
    }

    public void setTokens(List<InviteeResponse> tokens) {
        this.tokens = tokens;
    }

    public Pagination getPagination() {
        return pagination;
    }

    public void setPagination(Pagination pagination) {
        this.pagination = pagination;
    }

    public static class Pagination {

        private int page;
        private int limit;
        private int total;
        private int totalPages;

        public Pagination() {
        }

        public Pagination(int page, int limit, int total, int totalPages) {
            this.page = page;
            this.limit = limit;
            this.total = total;
            this.totalPages = totalPages;
        }

        public int getPage() {
            return page;
        }

        public int getLimit() {
            return limit;
        }

        public int getTotal() {
            return total;
        }

        public int getTotalPages() {
            return totalPages;
        }
    }
}
