package com.ospicorp.heartrate.web;

import com.ospicorp.heartrate.query.UserSummary;
import java.util.List;

public record UsersResponse(List<UserSummary> users, int count) {}
