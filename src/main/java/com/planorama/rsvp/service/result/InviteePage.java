package com.planorama.rsvp.service.result;

import java.util.List;

/**
 * One page of the invitee listing plus the totals after filtering.
 *
 * @author Planorama Team
 */
public class InviteePage {

    private final List<InviteeView> items;
    private final int page;
    private final int limit;
    private final int total;

    public InviteePage(List<InviteeView> items, int page, int limit, int total) {
        this.items = items;
        this.page = page;
        this.limit = limit;
        this.total = total;
    }

    public List<InviteeView> getItems() {
        return items;
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
        return (total + limit - 1) / limit;
    }
}
